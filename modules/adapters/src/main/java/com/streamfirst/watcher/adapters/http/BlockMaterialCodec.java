package com.streamfirst.watcher.adapters.http;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.streamfirst.watcher.domain.BlockMaterial;
import com.streamfirst.watcher.domain.BlockSignature;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Base64;

/**
 * JSON form of a block file as published by the archives.
 *
 * <pre>
 * {
 *   "index": 42,
 *   "contents": "&lt;base64 block bytes&gt;",
 *   "signature": { "signer": "&lt;hex&gt;", "signature": "&lt;hex&gt;", "signedAt": 1700000000 }
 * }
 * </pre>
 *
 * The {@code signature} member is optional, as is its {@code signedAt} member.
 */
public final class BlockMaterialCodec {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private BlockMaterialCodec() {
    }

    /**
     * Decodes a block file.
     *
     * @param json the UTF-8 encoded file contents
     * @return the decoded block material
     * @throws IllegalArgumentException if the contents are not a valid block file
     */
    public static BlockMaterial decode(byte[] json) {
        try {
            JsonElement root = JsonParser.parseString(new String(json, StandardCharsets.UTF_8));
            if (!root.isJsonObject()) {
                throw new IllegalArgumentException("Block file is not a JSON object");
            }
            return fromJson(root.getAsJsonObject());
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException | ClassCastException e) {
            throw new IllegalArgumentException("Malformed block file: " + e.getMessage(), e);
        }
    }

    /**
     * Encodes block material in the archive's block file format.
     */
    public static byte[] encode(BlockMaterial material) {
        return GSON.toJson(toJson(material)).getBytes(StandardCharsets.UTF_8);
    }

    static BlockMaterial fromJson(JsonObject json) {
        if (!json.has("index") || !json.has("contents")) {
            throw new IllegalArgumentException("Block file must have 'index' and 'contents'");
        }
        long index = json.get("index").getAsLong();
        byte[] contents = Base64.getDecoder().decode(json.get("contents").getAsString());
        BlockSignature signature = null;
        JsonElement signatureJson = json.get("signature");
        if (signatureJson != null && !signatureJson.isJsonNull()) {
            if (!signatureJson.isJsonObject()) {
                throw new IllegalArgumentException("Block signature must be a JSON object");
            }
            signature = signatureFromJson(signatureJson.getAsJsonObject());
        }
        return new BlockMaterial(index, contents, signature);
    }

    static JsonObject toJson(BlockMaterial material) {
        JsonObject json = new JsonObject();
        json.addProperty("index", material.getIndex());
        json.addProperty("contents", Base64.getEncoder().encodeToString(material.getContents()));
        material.getSignature().ifPresent(signature -> json.add("signature", signatureToJson(signature)));
        return json;
    }

    /**
     * Reads a signature object.
     *
     * @throws IllegalArgumentException if required members are missing
     */
    public static BlockSignature signatureFromJson(JsonObject json) {
        if (!json.has("signer") || !json.has("signature")) {
            throw new IllegalArgumentException("Signature must have 'signer' and 'signature'");
        }
        Instant signedAt = json.has("signedAt") && !json.get("signedAt").isJsonNull()
                ? Instant.ofEpochSecond(json.get("signedAt").getAsLong())
                : null;
        return new BlockSignature(
                json.get("signer").getAsString(),
                json.get("signature").getAsString(),
                signedAt);
    }

    public static JsonObject signatureToJson(BlockSignature signature) {
        JsonObject json = new JsonObject();
        json.addProperty("signer", signature.signer());
        json.addProperty("signature", signature.signature());
        signature.getSignedAt().ifPresent(at -> json.addProperty("signedAt", at.getEpochSecond()));
        return json;
    }
}
