package io.syncvault.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.syncvault.util.Hashing;
import io.syncvault.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SensitiveDataMaskerTest {

    @Test
    void credentialFieldsAreMaskedAtAnyDepth() throws Exception {
        JsonNode input = Jsons.mapper().readTree("""
                {"destination":"replica","connection":{"password":"pw","Authorization":"Bearer x"},
                 "handlers":[{"secretKey":"abc","name":"warehouse"}]}
                """);

        JsonNode masked = SensitiveDataMasker.masked(input);

        Assertions.assertEquals("replica", masked.path("destination").asText());
        Assertions.assertEquals("***", masked.path("connection").path("password").asText());
        Assertions.assertEquals("***", masked.path("connection").path("Authorization").asText());
        Assertions.assertEquals("***", masked.path("handlers").get(0).path("secretKey").asText());
        Assertions.assertEquals("warehouse", masked.path("handlers").get(0).path("name").asText());
    }

    @Test
    void fingerprintsStayReadableButOpaqueTokensDoNot() {
        String digest = Hashing.sha256Hex("records");

        Assertions.assertEquals(digest, SensitiveDataMasker.maskText(digest));
        Assertions.assertEquals(digest.substring(0, 16) + "...",
                SensitiveDataMasker.maskText(digest.substring(0, 16) + "..."));
        Assertions.assertEquals("***", SensitiveDataMasker.maskText("ghp_" + "A1b2C3d4E5".repeat(4)));
        Assertions.assertEquals("https://***@host/path", SensitiveDataMasker.maskText("https://u:p@host/path"));
        Assertions.assertEquals("rec-42", SensitiveDataMasker.maskText("rec-42"));
        Assertions.assertNull(SensitiveDataMasker.maskText(null));
    }
}
