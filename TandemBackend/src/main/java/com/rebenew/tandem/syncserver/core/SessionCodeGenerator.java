package com.rebenew.tandem.syncserver.core;

import com.rebenew.tandem.syncserver.config.SyncProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

// Fixed-length codes a person can read out and type (A-Z, 0-9).
@Component
public class SessionCodeGenerator {
    private static final char[] ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();

    private final SecureRandom random = new SecureRandom();
    private final int length;

    @Autowired
    public SessionCodeGenerator(SyncProperties properties) {
        this(properties.getSessionCodeLength());
    }

    public SessionCodeGenerator(int length) {
        if (length < 4) {
            throw new IllegalArgumentException("Session code length must be at least 4");
        }
        this.length = length;
    }

    public String next() {
        char[] code = new char[length];
        for (int i = 0; i < length; i++) {
            code[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(code);
    }

    public static String normalize(String code) {
        return code == null ? null : code.trim().toUpperCase();
    }
}
