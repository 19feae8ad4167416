package io.syncvault.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.syncvault.util.Jsons;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credentials in audit details. Record keys are expected in details (missing and
 * mismatched key lists), so a bare "key" field name is not treated as sensitive; only names
 * that denote credential material are.
 */
public final class SensitiveDataMasker {
    private static final String MASK = "***";
    private static final Set<String> SENSITIVE_HINTS = Set.of(
            "password", "passwd", "secret", "token", "authorization", "apikey", "api_key",
            "access_key", "private_key", "credential"
    );
    private static final Pattern URL_USERINFO = Pattern.compile("(?i)\\b([a-z][a-z0-9+.-]*://)[^/@\\s:]+:[^/@\\s]+@");
    private static final Pattern OPAQUE_TOKEN = Pattern.compile("^[A-Za-z0-9+/=_\\-:.]{40,}$");
    private static final Pattern HEX_DIGEST = Pattern.compile("^[0-9a-f]{16,64}(\\.\\.\\.)?$");

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null) {
            return Jsons.mapper().nullNode();
        }
        switch (input.getNodeType()) {
            case OBJECT:
                ObjectNode object = Jsons.mapper().createObjectNode();
                input.fields().forEachRemaining(field -> object.set(field.getKey(),
                        credentialField(field.getKey()) ? TextNode.valueOf(MASK) : masked(field.getValue())));
                return object;
            case ARRAY:
                ArrayNode array = Jsons.mapper().createArrayNode();
                input.forEach(element -> array.add(masked(element)));
                return array;
            case STRING:
                return TextNode.valueOf(maskText(input.textValue()));
            default:
                return input;
        }
    }

    public static String maskText(String value) {
        if (value == null) {
            return null;
        }
        String v = value.trim();
        // Fingerprints are safe to log and look like opaque tokens.
        if (HEX_DIGEST.matcher(v).matches()) {
            return value;
        }
        if (OPAQUE_TOKEN.matcher(v).matches()) {
            return MASK;
        }
        return URL_USERINFO.matcher(value).replaceAll("$1" + MASK + "@");
    }

    private static boolean credentialField(String rawKey) {
        if (rawKey == null || rawKey.isBlank()) {
            return false;
        }
        String key = rawKey.toLowerCase(Locale.ROOT);
        for (String hint : SENSITIVE_HINTS) {
            if (key.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
