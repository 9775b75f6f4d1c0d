package com.webapp.authservice.service;

public interface PasswordService {

    /** BCrypt hash of a non-blank raw password. */
    String hash(String rawPassword);

    /** False for null, blank or malformed input; never throws. */
    boolean verify(String rawPassword, String hash);

    /** Random password of at least 8 characters containing every character class. */
    String generateRandomPassword(int length);
}
