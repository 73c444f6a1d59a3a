package com.e2eq.pgraph.core;

import com.e2eq.pgraph.exceptions.PropertyGraphException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content-derived edge pids. The pid is the prefix followed by the hex SHA-256 of the
 * compact, key-sorted JSON {@code {"n":..,"o":[..],"p":..,"s":..}} where the object pids
 * are sorted, so object order does not change identity.
 */
public final class EdgeIdentity {
    private EdgeIdentity() {}

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    public static String edgePid(String prefix, String subject, String predicate, Collection<String> objects, String namedGraph) {
        return prefix + sha256Hex(canonicalJson(subject, predicate, objects, namedGraph));
    }

    public static String canonicalJson(String subject, String predicate, Collection<String> objects, String namedGraph) {
        List<String> sorted = new ArrayList<>(objects);
        sorted.sort(null);
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("s", subject);
        canonical.put("p", predicate);
        canonical.put("o", sorted);
        canonical.put("n", namedGraph);
        try {
            return MAPPER.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new PropertyGraphException("Failed to canonicalize edge (" + subject + ", " + predicate + ")", e);
        }
    }

    static String sha256Hex(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return bytesToHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new PropertyGraphException("SHA-256 not available", e);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
