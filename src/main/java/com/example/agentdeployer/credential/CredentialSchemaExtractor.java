package com.example.agentdeployer.credential;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Derives the credentials an operator must supply from an n8n workflow template.
 * <p>
 * Simple credentials are grouped by type. Generic auth types (see
 * {@link CredentialTypeRegistry#SPECIAL_TYPES}) are grouped by type and the
 * name the template gives them, so two header-auth secrets named differently
 * stay distinct. The template is only read, never modified.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialSchemaExtractor {

    private static final Pattern STOP_WORDS = Pattern.compile(
            "\\b(api|key|auth|token|production|prod|dev|development|test)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([A-Z])");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final CredentialTypeRegistry registry;

    public CredentialSchema extract(JsonNode template) {
        if (template == null || !template.path("nodes").isArray()) {
            throw new InvalidTemplateException("Invalid workflow JSON: missing 'nodes' array");
        }

        Map<String, Accumulator> byKey = new LinkedHashMap<>();
        for (JsonNode node : template.get("nodes")) {
            JsonNode credentials = node.path("credentials");
            if (!credentials.isObject()) {
                continue;
            }
            Iterator<Map.Entry<String, JsonNode>> refs = credentials.fields();
            while (refs.hasNext()) {
                Map.Entry<String, JsonNode> ref = refs.next();
                String type = ref.getKey();
                boolean special = registry.isSpecial(type);
                String name = special ? ref.getValue().path("name").asText("") : null;
                String key = special ? type + ":" + name : type;
                byKey.computeIfAbsent(key, k -> new Accumulator(type, name)).instances++;
            }
        }

        List<SimpleCredential> simple = new ArrayList<>();
        List<SpecialCredential> special = new ArrayList<>();
        for (Accumulator acc : byKey.values()) {
            Resolved resolved = resolveFields(acc.type);
            if (acc.name != null) {
                special.add(new SpecialCredential(
                        acc.type,
                        formatType(acc.type) + ": " + acc.name,
                        extractKeyword(acc.name),
                        acc.instances,
                        resolved.fields(),
                        resolved.oauth(),
                        resolved.note(),
                        resolved.inferred()));
            } else {
                simple.add(new SimpleCredential(
                        acc.type,
                        formatType(acc.type),
                        acc.instances,
                        resolved.fields(),
                        resolved.oauth(),
                        resolved.note(),
                        resolved.inferred()));
            }
        }
        log.debug("Extracted {} simple and {} special credentials", simple.size(), special.size());
        return new CredentialSchema(simple, special);
    }

    private Resolved resolveFields(String type) {
        return registry.find(type)
                .map(def -> new Resolved(def.fields(), def.oauth(), def.note(), false))
                .orElseGet(() -> inferFields(type));
    }

    private Resolved inferFields(String type) {
        String lower = type.toLowerCase(Locale.ROOT);
        if (lower.contains("oauth")) {
            log.warn("Unknown credential type '{}', assuming OAuth client id/secret", type);
            return new Resolved(List.of(
                    CredentialField.text("clientId", "Client ID"),
                    CredentialField.secret("clientSecret", "Client Secret")),
                    true, CredentialTypeRegistry.OAUTH_NOTE, true);
        }
        if (lower.contains("api") || lower.contains("token")) {
            log.warn("Unknown credential type '{}', assuming a single API key", type);
            return new Resolved(List.of(CredentialField.secret("apiKey", "API Key")), false, null, true);
        }
        log.warn("Unknown credential type '{}', assuming a single secret value", type);
        return new Resolved(List.of(CredentialField.secret("credential", "Credential Value")), false, null, true);
    }

    /** Best-effort label for matching an operator's secret, e.g. "DataforSEO API Key" becomes "DataforSEO". */
    static String extractKeyword(String name) {
        String stripped = STOP_WORDS.matcher(name).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /** "openAiApi" becomes "Open Ai", "httpHeaderAuth" becomes "Http Header". */
    static String formatType(String type) {
        if (type == null || type.isEmpty()) {
            return "";
        }
        String spaced = CAMEL_BOUNDARY.matcher(type).replaceAll(" $1");
        String capitalized = Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
        String stripped = capitalized.replaceFirst("Api", "").replaceFirst("Auth", "");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    private static final class Accumulator {
        private final String type;
        private final String name;
        private int instances;

        private Accumulator(String type, String name) {
            this.type = type;
            this.name = name;
        }
    }

    private record Resolved(List<CredentialField> fields, boolean oauth, String note, boolean inferred) {
    }
}
