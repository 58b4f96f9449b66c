package com.example.agentdeployer.credential;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only table of known n8n credential types, loaded once from
 * {@code credential-types.yml} on the classpath.
 */
@Slf4j
@Component
public class CredentialTypeRegistry {

    public static final String DEFAULT_RESOURCE = "credential-types.yml";

    /**
     * Generic auth types whose instances can only be told apart by the name the
     * template author gave them. Extend here when n8n adds similar types.
     */
    public static final Set<String> SPECIAL_TYPES = Set.of("httpHeaderAuth", "httpBasicAuth", "customAuth");

    public static final String OAUTH_NOTE = "Requires completing the OAuth consent flow in n8n after deployment. "
            + "The credential is created but stays unauthorized until then.";

    private final Map<String, CredentialTypeDefinition> definitions;

    public CredentialTypeRegistry() {
        this(loadResource(DEFAULT_RESOURCE));
    }

    public CredentialTypeRegistry(Map<String, CredentialTypeDefinition> definitions) {
        this.definitions = Map.copyOf(definitions);
        log.info("Loaded {} credential type definitions", this.definitions.size());
    }

    public Optional<CredentialTypeDefinition> find(String type) {
        return Optional.ofNullable(definitions.get(type));
    }

    public boolean isSpecial(String type) {
        return SPECIAL_TYPES.contains(type);
    }

    /** Registered OAuth types, plus unknown types whose name says OAuth. */
    public boolean requiresOAuth(String type) {
        return find(type)
                .map(CredentialTypeDefinition::oauth)
                .orElseGet(() -> type != null && type.toLowerCase(Locale.ROOT).contains("oauth"));
    }

    public int size() {
        return definitions.size();
    }

    static Map<String, CredentialTypeDefinition> loadResource(String resource) {
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            return parse(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load credential type registry " + resource, e);
        }
    }

    static Map<String, CredentialTypeDefinition> parse(InputStream yaml) throws IOException {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        RegistryFile file = yamlMapper.readValue(yaml, RegistryFile.class);

        Map<String, CredentialTypeDefinition> result = new HashMap<>();
        if (file.types() != null) {
            file.types().forEach((type, entry) -> result.put(type, new CredentialTypeDefinition(
                    type,
                    entry.oauth(),
                    entry.oauth() && entry.note() == null ? OAUTH_NOTE : entry.note(),
                    entry.fields())));
        }
        return result;
    }

    record RegistryFile(Map<String, Entry> types) {
    }

    record Entry(boolean oauth, String note, List<CredentialField> fields) {
    }
}
