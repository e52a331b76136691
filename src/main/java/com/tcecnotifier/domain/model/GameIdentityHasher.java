package com.tcecnotifier.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Computes the 64-bit identity of a game.
 *
 * The identity covers both players, the date and the opening book line, so a
 * game is "the same" when the same engines play the same book on the same day.
 * Replays with an identical opening are not told apart.
 *
 * The fields are canonicalized to a JSON array and digested with SHA-256; the
 * first eight bytes of the digest form the hash, which keeps it stable across
 * JVMs and restarts.
 */
public final class GameIdentityHasher {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GameIdentityHasher() {}

    public static long computeHash(PgnGame game) {
        ArrayNode canonical = MAPPER.createArrayNode();
        canonical.add(game.getWhitePlayer().getNormalized());
        canonical.add(game.getBlackPlayer().getNormalized());
        canonical.add(game.getDate());

        ArrayNode opening = canonical.addArray();
        for (PgnMove move : game.opening()) {
            opening.add(move.notation());
        }

        try {
            String json = MAPPER.writeValueAsString(canonical);
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(json.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to compute game identity hash", e);
        }
    }
}
