package com.whereq.netpilot.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Work requested by a job. Which fields are set depends on the job type.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobPayload implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Commands to run (run_commands)
     */
    private List<String> commands;

    /**
     * Per-device timeout in seconds; the configured default applies when null
     */
    private Integer timeoutSeconds;

    /**
     * Configuration snippet (deploy_preview, deploy_commit)
     */
    private String snippet;

    /**
     * Merge or replace (deploy_preview, deploy_commit)
     */
    private ConfigMode mode;

    /**
     * Label stored with config snapshots (backup)
     */
    private String sourceLabel;

    /**
     * SHA-256 over mode and snippet, used to prove a commit applies exactly what was previewed
     */
    public String configFingerprint() {
        String material = (mode != null ? mode.getWireName() : "") + "\n" + (snippet != null ? snippet : "");
        return sha256Hex(material);
    }

    public static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
