// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import sh.cask.core.builder.DeployBuilder;
import sh.cask.core.cltype.CLType;
import sh.cask.core.cltype.CLValue;
import sh.cask.core.cltype.CLValues;
import sh.cask.core.cltype.SimpleType;
import sh.cask.core.crypto.KeyAlgorithm;
import sh.cask.core.crypto.KeyPair;
import sh.cask.core.crypto.PublicKey;
import sh.cask.core.deploy.Deploy;
import sh.cask.core.deploy.DeploySigner;
import sh.cask.core.deploy.RuntimeArgs;
import sh.cask.core.types.Hash;

class DeployJsonTest {

    private static final KeyPair SENDER = KeyPair.fromPrivateKeyHex(KeyAlgorithm.ED25519,
            "9d61b19deffd5a60ba844af492ec2cc44449c5697b326919703bac031cae7f60");
    private static final PublicKey TARGET = PublicKey.fromHex("02" + "aa".repeat(33));

    private static Deploy transfer() {
        return DeployBuilder.create()
                .account(SENDER.publicKey())
                .timestamp(Instant.parse("2024-01-01T00:00:30Z"))
                .standardPayment("100000000")
                .transfer("2500000000", TARGET, null)
                .build();
    }

    @Test
    void headerFields() {
        Deploy deploy = transfer();

        JsonNode header = DeployJson.toJsonNode(deploy).get("header");

        assertEquals(SENDER.publicKey().toHex(), header.get("account").asText());
        assertEquals("2024-01-01T00:00:00.000Z", header.get("timestamp").asText());
        assertEquals("30m", header.get("ttl").asText());
        assertEquals(1, header.get("gas_price").asLong());
        assertEquals(deploy.header().bodyHash().value(), header.get("body_hash").asText());
        assertTrue(header.get("dependencies").isArray());
        assertEquals("casper-test", header.get("chain_name").asText());
    }

    @Test
    void paymentAndSessionAreWrappedByVariantName() {
        ObjectNode root = DeployJson.toJsonNode(transfer());

        JsonNode payment = root.get("payment").get("ModuleBytes");
        assertEquals("", payment.get("module_bytes").asText());
        JsonNode amount = payment.get("args").get(0);
        assertEquals("amount", amount.get(0).asText());
        assertEquals("U512", amount.get(1).get("cl_type").asText());
        assertEquals("0400e1f505", amount.get(1).get("bytes").asText());
        assertEquals("100000000", amount.get(1).get("parsed").asText());

        JsonNode session = root.get("session").get("Transfer").get("args");
        assertEquals(3, session.size());
        assertEquals("PublicKey", session.get(1).get(1).get("cl_type").asText());
        JsonNode id = session.get(2).get(1);
        assertEquals("U64", id.get("cl_type").get("Option").asText());
        assertEquals("00", id.get("bytes").asText());
        assertTrue(id.get("parsed").isNull());
    }

    @Test
    void approvalsCarryTaggedHex() {
        Deploy signed = DeploySigner.signDeploy(transfer(), SENDER);

        JsonNode approval = DeployJson.toJsonNode(signed).get("approvals").get(0);

        assertEquals(SENDER.publicKey().toHex(), approval.get("signer").asText());
        assertEquals(signed.approvals().get(0).signature().toHex(), approval.get("signature").asText());
        assertEquals(130, approval.get("signature").asText().length());
    }

    @Test
    void compositeTypes() {
        assertEquals("{\"ByteArray\":32}", DeployJson.clType(CLType.byteArray(32)).toString());
        assertEquals("{\"List\":{\"Option\":\"String\"}}",
                DeployJson.clType(CLType.list(CLType.option(SimpleType.STRING))).toString());
        assertEquals("{\"Map\":{\"key\":\"String\",\"value\":\"U512\"}}",
                DeployJson.clType(CLType.map(SimpleType.STRING, SimpleType.U512)).toString());
    }

    @Test
    void mapParsedKeepsInsertionOrder() {
        Map<CLValue, CLValue> entries = new LinkedHashMap<>();
        entries.put(CLValues.string("b"), CLValues.u512(BigInteger.TWO));
        entries.put(CLValues.string("a"), CLValues.u512(BigInteger.ONE));

        JsonNode parsed = DeployJson.clValue(CLValues.map(SimpleType.STRING, SimpleType.U512, entries)).get("parsed");

        assertEquals("b", parsed.get(0).get("key").asText());
        assertEquals("2", parsed.get(0).get("value").asText());
        assertEquals("a", parsed.get(1).get("key").asText());
    }

    @Test
    void storedVersionedContractFields() throws Exception {
        Hash contract = new Hash("cc".repeat(32));
        Deploy deploy = DeployBuilder.create()
                .account(SENDER.publicKey())
                .timestamp(Instant.parse("2024-01-01T00:00:30Z"))
                .standardPayment("100000000")
                .storedVersionedContractByHash(contract, null, "mint",
                        RuntimeArgs.of("ids", CLValues.list(SimpleType.U64, List.of(CLValues.u64(1)))))
                .build();

        JsonNode parsed = new ObjectMapper().readTree(DeployJson.toJson(deploy));
        JsonNode session = parsed.get("session").get("StoredVersionedContractByHash");

        assertEquals(contract.value(), session.get("hash").asText());
        assertTrue(session.get("version").isNull());
        assertEquals("mint", session.get("entry_point").asText());
        assertEquals("U64", session.get("args").get(0).get(1).get("cl_type").get("List").asText());
        assertEquals(deploy.hash().value(), parsed.get("hash").asText());
    }
}
