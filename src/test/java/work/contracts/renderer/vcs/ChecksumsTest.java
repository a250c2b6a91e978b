package work.contracts.renderer.vcs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ChecksumsTest {

    @Test
    void usesHashlibAlgorithmNames() {
        assertEquals("d41d8cd98f00b204e9800998ecf8427e", Checksums.hexDigest("md5", ""));
        assertEquals("a9993e364706816aba3e25717850c26c9cd0d89d", Checksums.hexDigest("sha1", "abc"));
        assertEquals(
            "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
            Checksums.hexDigest("SHA256", "abc")
        );
    }

    @Test
    void rejectsUnknownAlgorithms() {
        assertThrows(IllegalArgumentException.class, () -> Checksums.hexDigest("crc99", "abc"));
    }
}
