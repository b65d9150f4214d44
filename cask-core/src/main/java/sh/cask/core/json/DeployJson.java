// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.cask.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import sh.cask.core.cltype.ByteArrayType;
import sh.cask.core.cltype.CLType;
import sh.cask.core.cltype.CLValue;
import sh.cask.core.cltype.ListType;
import sh.cask.core.cltype.MapType;
import sh.cask.core.cltype.OptionType;
import sh.cask.core.cltype.SimpleType;
import sh.cask.core.deploy.Deploy;
import sh.cask.core.deploy.DeployApproval;
import sh.cask.core.deploy.DeployHeader;
import sh.cask.core.deploy.ExecutableDeployItem;
import sh.cask.core.deploy.NamedArg;
import sh.cask.core.deploy.RuntimeArgs;
import sh.cask.core.error.EncodingException;
import sh.cask.core.types.Hash;
import sh.cask.primitives.Hex;

/**
 * Renders a {@link Deploy} in the node's JSON-RPC shape, as sent by {@code account_put_deploy}.
 *
 * <p>
 * The JSON form is for transport only; hashes are always computed from the binary
 * serialization. CLTypes render by name ({@code "U512"}) or as nested objects
 * ({@code {"Option":"U64"}}, {@code {"ByteArray":32}},
 * {@code {"Map":{"key":"String","value":"U512"}}}), and each argument as a
 * {@code [name, {cl_type, bytes, parsed}]} pair.
 *
 * <pre>{@code
 * String body = DeployJson.toJson(signed);
 * }</pre>
 */
public final class DeployJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DeployJson() {}

    /**
     * @throws EncodingException if Jackson cannot write the tree
     */
    public static String toJson(final Deploy deploy) {
        try {
            return MAPPER.writeValueAsString(toJsonNode(deploy));
        } catch (JsonProcessingException e) {
            throw new EncodingException("Failed to render deploy JSON: " + e.getMessage(), e);
        }
    }

    public static ObjectNode toJsonNode(final Deploy deploy) {
        final ObjectNode root = MAPPER.createObjectNode();
        root.put("hash", deploy.hash().value());
        root.set("header", header(deploy.header()));
        root.set("payment", item(deploy.payment()));
        root.set("session", item(deploy.session()));
        final ArrayNode approvals = root.putArray("approvals");
        for (DeployApproval approval : deploy.approvals()) {
            approvals.addObject()
                    .put("signer", approval.signer().toHex())
                    .put("signature", approval.signature().toHex());
        }
        return root;
    }

    /** JSON form of a type descriptor. */
    public static JsonNode clType(final CLType type) {
        if (type instanceof SimpleType simple) {
            return MAPPER.getNodeFactory().textNode(simple.typeName());
        }
        final ObjectNode node = MAPPER.createObjectNode();
        if (type instanceof OptionType option) {
            node.set("Option", clType(option.inner()));
        } else if (type instanceof ListType list) {
            node.set("List", clType(list.element()));
        } else if (type instanceof ByteArrayType byteArray) {
            node.put("ByteArray", byteArray.length());
        } else if (type instanceof MapType map) {
            final ObjectNode inner = node.putObject("Map");
            inner.set("key", clType(map.key()));
            inner.set("value", clType(map.value()));
        }
        return node;
    }

    /** JSON form of a value: {@code {cl_type, bytes, parsed}}. */
    public static ObjectNode clValue(final CLValue value) {
        final ObjectNode node = MAPPER.createObjectNode();
        node.set("cl_type", clType(value.type()));
        node.put("bytes", value.hex());
        node.set("parsed", MAPPER.valueToTree(value.parsed()));
        return node;
    }

    private static ObjectNode header(final DeployHeader header) {
        final ObjectNode node = MAPPER.createObjectNode();
        node.put("account", header.account().toHex());
        node.put("timestamp", header.timestampIso());
        node.put("ttl", header.ttlText());
        node.put("gas_price", header.gasPrice());
        node.put("body_hash", header.bodyHash().value());
        final ArrayNode dependencies = node.putArray("dependencies");
        for (Hash dependency : header.dependencies()) {
            dependencies.add(dependency.value());
        }
        node.put("chain_name", header.chainName());
        return node;
    }

    private static ObjectNode item(final ExecutableDeployItem item) {
        final ObjectNode wrapper = MAPPER.createObjectNode();
        final ObjectNode body = wrapper.putObject(item.variantName());
        if (item instanceof ExecutableDeployItem.ModuleBytes moduleBytes) {
            body.put("module_bytes", Hex.encode(moduleBytes.moduleBytes()));
        } else if (item instanceof ExecutableDeployItem.StoredContractByHash byHash) {
            body.put("hash", byHash.hash().value());
            body.put("entry_point", byHash.entryPoint());
        } else if (item instanceof ExecutableDeployItem.StoredContractByName byName) {
            body.put("name", byName.name());
            body.put("entry_point", byName.entryPoint());
        } else if (item instanceof ExecutableDeployItem.StoredVersionedContractByHash versioned) {
            body.put("hash", versioned.hash().value());
            body.put("version", versioned.version());
            body.put("entry_point", versioned.entryPoint());
        } else if (item instanceof ExecutableDeployItem.StoredVersionedContractByName versioned) {
            body.put("name", versioned.name());
            body.put("version", versioned.version());
            body.put("entry_point", versioned.entryPoint());
        }
        body.set("args", args(item.args()));
        return wrapper;
    }

    private static ArrayNode args(final RuntimeArgs args) {
        final ArrayNode array = MAPPER.createArrayNode();
        for (NamedArg arg : args.args()) {
            array.addArray()
                    .add(arg.name())
                    .add(clValue(arg.value()));
        }
        return array;
    }
}
