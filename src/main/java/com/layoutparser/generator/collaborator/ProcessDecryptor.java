package com.layoutparser.generator.collaborator;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.layoutparser.generator.exception.CollaboratorException;

/**
 * Decrypts by piping the payload through an external command (stdin to stdout).
 * Stored values carry a three character prefix that is stripped first.
 */
public class ProcessDecryptor implements Decryptor {

    private static final Logger log = LoggerFactory.getLogger(ProcessDecryptor.class);

    static final int PREFIX_LENGTH = 3;
    private static final String COLLABORATOR = "decryptor";

    private final List<String> command;
    private final Duration timeout;

    public ProcessDecryptor(List<String> command, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Decrypt command must not be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    @Override
    public String decrypt(String ciphertext) {
        if (ciphertext == null || ciphertext.length() <= PREFIX_LENGTH) {
            log.warn("Content too short to decrypt, using it as stored");
            return ciphertext;
        }
        String payload = ciphertext.substring(PREFIX_LENGTH);
        try {
            String plain = run(payload);
            log.debug("Decrypted {} characters", plain.length());
            return plain;
        } catch (IOException | CollaboratorException e) {
            log.warn("Decryption failed ({}), using content as stored", e.getMessage());
            return ciphertext;
        }
    }

    private String run(String payload) throws IOException {
        Process process = new ProcessBuilder(command).redirectError(ProcessBuilder.Redirect.DISCARD).start();
        try {
            return CollaboratorCalls.call(COLLABORATOR, timeout, () -> {
                // stdout must be drained while stdin is written, both pipes are bounded
                Future<String> stdout = CollaboratorCalls.background(() -> {
                    try (InputStream in = process.getInputStream()) {
                        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
                    }
                });
                try (OutputStream stdin = process.getOutputStream()) {
                    stdin.write(payload.getBytes(StandardCharsets.UTF_8));
                } catch (IOException e) {
                    stdout.cancel(true);
                    throw e;
                }
                String output = stdout.get();
                int exit = process.waitFor();
                if (exit != 0) {
                    throw new CollaboratorException(COLLABORATOR, "command exited with status " + exit);
                }
                return output.strip();
            });
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }
}
