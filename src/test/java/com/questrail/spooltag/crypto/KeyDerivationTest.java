package com.questrail.spooltag.crypto;

import com.questrail.spooltag.tag.KeySet;
import com.questrail.spooltag.tag.TagUid;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KeyDerivationTest
 * -----------------------------------------------------------------------------
 * Known-answer vectors for the HKDF-SHA256 sector key derivation.
 */
class KeyDerivationTest {

    private final KeyDerivation kdf = new KeyDerivation(KeyDerivationConfig.defaults());

    @Test
    void deadbeefMatchesKnownKeys() {
        KeySet keys = kdf.deriveFromHex("DEADBEEF");

        assertEquals(List.of(
                "045C6DC690E9", "DAF05C224715", "141899C0B498", "375533C16DE8",
                "EA75FD5C2EC2", "F6AC7FD01B75", "E3D94B7C914D", "3FEC6971DD78",
                "5B57EFFC5D7A", "1B31535EFFE7", "4C9BBD4EE19F", "8A5CD3180C93",
                "33BE1598F79E", "1A43690778FA", "C192E145B713", "46CF8B20C176"
        ), keys.toHex());
    }

    @Test
    void secondUidMatchesKnownKeys() {
        KeySet keys = kdf.derive(TagUid.fromHex("7AD43F1C"));

        assertEquals(List.of(
                "7C6247A1F519", "EF436198CF7C", "9EB16AE63881", "1740722DC45C",
                "338C5E85E9F2", "36F99E0D0C62", "17F4D435C54A", "47D343922E67",
                "A14F2AFA213B", "F8083CB6D678", "91261769D875", "925658D3AEC1",
                "EDFBD914D56D", "1D3AE56B1886", "B73AEC2D6223", "56A426A90DD8"
        ), keys.toHex());
    }

    @Test
    void derivationIsDeterministic() {
        byte[] uid = {0x01, 0x02, 0x03, 0x04};
        assertEquals(kdf.derive(uid), kdf.derive(uid.clone()));
        assertEquals(kdf.derive(uid), new KeyDerivation(KeyDerivationConfig.defaults()).derive(uid));
    }

    @Test
    void hexInputIgnoresCaseAndWhitespace() {
        assertEquals(kdf.deriveFromHex("DEADBEEF"), kdf.deriveFromHex("  deadbeef "));
    }

    @Test
    void differentUidsGiveDifferentKeys() {
        assertNotEquals(kdf.deriveFromHex("DEADBEEF"), kdf.deriveFromHex("DEADBEEE"));
    }

    @Test
    void nonStandardUidLengthIsAccepted() {
        // Seven-byte uids exist on other tag families.
        KeySet keys = kdf.derive(new byte[]{1, 2, 3, 4, 5, 6, 7});
        assertEquals(16, keys.keys().size());
    }

    @Test
    void emptyUidIsRejected() {
        assertThrows(InvalidInputException.class, () -> kdf.derive(new byte[0]));
        assertThrows(InvalidInputException.class, () -> kdf.derive((byte[]) null));
        assertThrows(InvalidInputException.class, () -> kdf.deriveFromHex(""));
        assertThrows(InvalidInputException.class, () -> kdf.deriveFromHex("   "));
    }

    @Test
    void nonHexUidIsRejected() {
        assertThrows(InvalidInputException.class, () -> kdf.deriveFromHex("NOTHEXXX"));
    }

    @Test
    void otherSecretGivesOtherKeys() {
        KeyDerivationConfig other = new KeyDerivationConfig(new byte[16], "RFID-A\0".getBytes(java.nio.charset.StandardCharsets.US_ASCII));
        assertNotEquals(kdf.deriveFromHex("DEADBEEF"), new KeyDerivation(other).deriveFromHex("DEADBEEF"));
    }

    @Test
    void configRejectsWrongSizes() {
        assertThrows(IllegalArgumentException.class, () -> new KeyDerivationConfig(new byte[15], new byte[7]));
        assertThrows(IllegalArgumentException.class, () -> new KeyDerivationConfig(new byte[16], new byte[6]));
    }

    @Test
    void configDoesNotPrintSecret() {
        assertFalse(KeyDerivationConfig.defaults().toString().contains("9A75"));
    }
}
