package de.htwsaar.assetpipe.assets.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ContentHasherTest {

    @Test
    void hashIsDeterministic() {
        byte[] content = "alert(1)".getBytes(StandardCharsets.UTF_8);

        HashedContent first = ContentHasher.hash(content);
        HashedContent second = ContentHasher.hash(content.clone());

        assertEquals(first, second);
        assertEquals("6e11c72f", first.fingerprint());
        assertEquals(
                "sha384-HT2E9NfWiuQ/w1PRai+hTyqW16NIoCGA/m8VQDUopfAtcz6YQjtsMmQd5uRbVDpW", first.integrity());
        assertEquals(64, first.sha256Hex().length());
        assertEquals(first.sha256Hex().substring(0, 8), first.fingerprint());
    }

    @Test
    void oneChangedByteChangesFingerprintAndIntegrity() {
        HashedContent a = ContentHasher.hash("alert(1)".getBytes(StandardCharsets.UTF_8));
        HashedContent b = ContentHasher.hash("alert(2)".getBytes(StandardCharsets.UTF_8));

        assertNotEquals(a.fingerprint(), b.fingerprint());
        assertNotEquals(a.integrity(), b.integrity());
    }

    @Test
    void versionedNameInsertsFingerprintBeforeLastExtension() {
        assertEquals("app.3f2a1b9c.js", ContentHasher.versionedName("app.js", "3f2a1b9c"));
        assertEquals("app.min.3f2a1b9c.js", ContentHasher.versionedName("app.min.js", "3f2a1b9c"));
        assertEquals("LICENSE.3f2a1b9c", ContentHasher.versionedName("LICENSE", "3f2a1b9c"));
        assertEquals(".env.3f2a1b9c", ContentHasher.versionedName(".env", "3f2a1b9c"));
    }
}
