package com.example.agentdeployer.credential;

/**
 * The workflow template is not a usable n8n workflow document.
 */
public class InvalidTemplateException extends IllegalArgumentException {

    public InvalidTemplateException(String message) {
        super(message);
    }
}
