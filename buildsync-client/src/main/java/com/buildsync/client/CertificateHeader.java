package com.buildsync.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Optional;

/**
 * Client certificate sent as {@value #NAME} on every request: the base64 encoding of the (trimmed) PEM file.
 * The file is read once, on first use. A missing, unreadable or empty file means no header is sent.
 */
public final class CertificateHeader {

    public static final String NAME = "IB-Certificate";

    private static final Logger log = LoggerFactory.getLogger(CertificateHeader.class);

    private final Path certificateFile;
    private volatile Optional<String> value;

    public CertificateHeader(Path certificateFile) {
        this.certificateFile = certificateFile;
    }

    /** Header that is never sent. */
    public static CertificateHeader none() {
        return new CertificateHeader(null);
    }

    public Optional<String> value() {
        Optional<String> v = value;
        if (v == null) {
            synchronized (this) {
                v = value;
                if (v == null) {
                    v = load();
                    value = v;
                }
            }
        }
        return v;
    }

    private Optional<String> load() {
        if (certificateFile == null) {
            return Optional.empty();
        }
        byte[] raw;
        try {
            raw = Files.readAllBytes(certificateFile);
        } catch (IOException e) {
            log.warn("Client certificate file={} not readable; requests are sent without {}: {}",
                    certificateFile, NAME, e.getMessage());
            return Optional.empty();
        }
        String pem = new String(raw, StandardCharsets.ISO_8859_1).strip();
        if (pem.isEmpty()) {
            log.warn("Client certificate file={} is empty; requests are sent without {}", certificateFile, NAME);
            return Optional.empty();
        }
        return Optional.of(Base64.getEncoder().encodeToString(pem.getBytes(StandardCharsets.ISO_8859_1)));
    }
}
