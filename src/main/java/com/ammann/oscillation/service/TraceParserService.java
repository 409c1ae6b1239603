/* (C)2026 */
package com.ammann.oscillation.service;

import com.ammann.oscillation.exception.TraceReadException;
import com.ammann.oscillation.model.Sample;
import com.ammann.oscillation.model.Trace;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses oscilloscope text exports into a {@link Trace}.
 *
 * <p>Accepted input is newline-delimited text. Lines starting with a double or single quote
 * are instrument metadata and are skipped. Data lines carry whitespace-separated tokens where
 * decimal commas are accepted: {@code time voltage} or {@code time min max}, in which case the
 * stored voltage is the mean of min and max. Rows whose voltage exceeds {@value #CLIP_LIMIT} in
 * magnitude are clipping sentinels and are dropped, as are rows that do not start with two
 * finite numbers.
 */
@ApplicationScoped
public class TraceParserService
{

    private static final Logger LOG = Logger.getLogger(TraceParserService.class);

    static final double CLIP_LIMIT = 1e30;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Parses the given text. Malformed lines are skipped; an empty trace is returned when
     * no line matched.
     *
     * @param content file content
     * @return samples in file order
     */
    public Trace parse(String content)
    {
        if (content == null || content.isEmpty()) {
            return Trace.empty();
        }

        List<Sample> samples = new ArrayList<>();
        int skipped = 0;

        for (String line : content.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("\"") || trimmed.startsWith("'")) {
                continue;
            }

            Sample sample = parseLine(trimmed);
            if (sample == null) {
                skipped++;
                continue;
            }
            samples.add(sample);
        }

        LOG.debugf("Parsed %d samples, skipped %d malformed or clipped lines", samples.size(), skipped);
        return new Trace(samples);
    }

    /**
     * Decodes the stream strictly with the given charset and parses the result.
     *
     * @throws TraceReadException if the stream cannot be read or is not valid in {@code charset}
     */
    public Trace parse(InputStream input, Charset charset)
    {
        try {
            byte[] bytes = input.readAllBytes();
            String content = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return parse(content);
        } catch (CharacterCodingException e) {
            throw new TraceReadException("Trace is not valid " + charset.name() + " text", e);
        } catch (IOException e) {
            throw new TraceReadException("Failed to read trace upload", e);
        }
    }

    Sample parseLine(String trimmed)
    {
        String[] parts = WHITESPACE.split(trimmed.replace(',', '.'));
        if (parts.length < 2) {
            return null;
        }

        double time = parseNumber(parts[0]);
        double voltage = parseNumber(parts[1]);
        if (!Double.isFinite(time) || !Double.isFinite(voltage)) {
            return null;
        }
        if (Math.abs(voltage) > CLIP_LIMIT) {
            return null;
        }

        // Envelope export: time, min, max
        if (parts.length >= 3) {
            double upper = parseNumber(parts[2]);
            if (Double.isFinite(upper) && Math.abs(upper) < CLIP_LIMIT) {
                voltage = (voltage + upper) / 2;
            }
        }

        return new Sample(time, voltage);
    }

    private static double parseNumber(String token)
    {
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }
}
