// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.deploy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import sh.cask.core.cltype.CLValues;
import sh.cask.core.error.EncodingException;
import sh.cask.core.types.Hash;
import sh.cask.primitives.Hex;

class ExecutableDeployItemTest {

    private static final String AMOUNT_ARGS = "01000000" + "06000000616d6f756e74" + "050000000400f90295" + "08";
    private static final String EMPTY_ARGS = "00000000";
    private static final Hash CONTRACT = new Hash("cc".repeat(32));
    // "transfer"
    private static final String ENTRY_POINT = "08000000" + "7472616e73666572";

    @Test
    void standardPaymentIsEmptyModuleWithAmount() {
        ExecutableDeployItem payment = ExecutableDeployItem.standardPayment("2500000000");

        assertEquals("00" + "00000000" + AMOUNT_ARGS, Hex.encode(payment.toBytes()));
        assertEquals("ModuleBytes", payment.variantName());
    }

    @Test
    void moduleBytesAreLengthPrefixed() {
        ExecutableDeployItem item = new ExecutableDeployItem.ModuleBytes(new byte[] {0x00, 0x61, 0x73, 0x6d}, RuntimeArgs.empty());

        assertEquals("00" + "04000000" + "0061736d" + EMPTY_ARGS, Hex.encode(item.toBytes()));
    }

    @Test
    void storedContractByHash() {
        ExecutableDeployItem item = new ExecutableDeployItem.StoredContractByHash(CONTRACT, "transfer", RuntimeArgs.empty());

        assertEquals("01" + "cc".repeat(32) + ENTRY_POINT + EMPTY_ARGS, Hex.encode(item.toBytes()));
    }

    @Test
    void storedContractByNameWritesNameAndEntryPoint() {
        ExecutableDeployItem item = new ExecutableDeployItem.StoredContractByName("erc20", "transfer", RuntimeArgs.empty());

        assertEquals("02" + "050000006572633230" + ENTRY_POINT + EMPTY_ARGS, Hex.encode(item.toBytes()));
    }

    @Test
    void versionedByHashWritesOptionalVersion() {
        ExecutableDeployItem pinned = new ExecutableDeployItem.StoredVersionedContractByHash(
                CONTRACT, 2L, "transfer", RuntimeArgs.empty());
        ExecutableDeployItem latest = new ExecutableDeployItem.StoredVersionedContractByHash(
                CONTRACT, null, "transfer", RuntimeArgs.empty());

        assertEquals("03" + "cc".repeat(32) + "01" + "02000000" + ENTRY_POINT + EMPTY_ARGS, Hex.encode(pinned.toBytes()));
        assertEquals("03" + "cc".repeat(32) + "00" + ENTRY_POINT + EMPTY_ARGS, Hex.encode(latest.toBytes()));
    }

    @Test
    void versionedByNameWritesOptionalVersion() {
        ExecutableDeployItem item = new ExecutableDeployItem.StoredVersionedContractByName(
                "erc20", 1L, "transfer", RuntimeArgs.empty());

        assertEquals("04" + "050000006572633230" + "01" + "01000000" + ENTRY_POINT + EMPTY_ARGS,
                Hex.encode(item.toBytes()));
    }

    @Test
    void transferIsTagAndArgs() {
        ExecutableDeployItem item = new ExecutableDeployItem.Transfer(
                RuntimeArgs.of("amount", CLValues.u512("2500000000")));

        assertEquals("05" + AMOUNT_ARGS, Hex.encode(item.toBytes()));
    }

    @Test
    void versionMustFitU32() {
        assertThrows(EncodingException.class, () -> new ExecutableDeployItem.StoredVersionedContractByName(
                "erc20", 1L << 32, "transfer", RuntimeArgs.empty()));
        assertThrows(EncodingException.class, () -> new ExecutableDeployItem.StoredVersionedContractByHash(
                CONTRACT, -1L, "transfer", RuntimeArgs.empty()));
    }

    @Test
    void moduleBytesCompareByContent() {
        ExecutableDeployItem a = new ExecutableDeployItem.ModuleBytes(new byte[] {1}, RuntimeArgs.empty());

        assertEquals(a, new ExecutableDeployItem.ModuleBytes(new byte[] {1}, RuntimeArgs.empty()));
        assertNotEquals(a, new ExecutableDeployItem.ModuleBytes(new byte[] {2}, RuntimeArgs.empty()));
    }
}
