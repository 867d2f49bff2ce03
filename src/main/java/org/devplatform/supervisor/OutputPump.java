package org.devplatform.supervisor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Copies one output stream of a child process, line by line, to the service's output logger
 * {@code devplatform.output.<service>}. Ends when the stream closes.
 */
final class OutputPump implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(OutputPump.class);

    private final String service;
    private final InputStream stream;
    private final boolean stderr;
    private final Logger output;

    OutputPump(final String service, final InputStream stream, final boolean stderr) {
        this.service = service;
        this.stream = stream;
        this.stderr = stderr;
        this.output = LoggerFactory.getLogger("devplatform.output." + service);
    }

    @Override
    public void run() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (stderr) {
                    output.warn(line);
                } else {
                    output.info(line);
                }
            }
        } catch (final IOException e) {
            // Stream closed under us when the process is killed.
            log.debug("Output of '{}' ended: {}", service, e.getMessage());
        }
    }
}
