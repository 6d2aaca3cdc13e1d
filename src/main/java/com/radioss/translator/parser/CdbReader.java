package com.radioss.translator.parser;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.radioss.translator.exception.MalformedRecordException;
import com.radioss.translator.model.MeshModel;

import lombok.RequiredArgsConstructor;

/**
 * Loads a CDB export, parses it and runs the integrity checks.
 */
@RequiredArgsConstructor
public class CdbReader {
    private static final Logger log = LoggerFactory.getLogger(CdbReader.class);

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final ParserOptions options;

    public CdbReader() {
        this(ParserOptions.defaults());
    }

    public MeshModel read(Path file) throws IOException {
        log.info("Reading {}", file);
        return parseLines(decodeLines(Files.readAllBytes(file)), file.getFileName().toString());
    }

    public MeshModel read(String text, String sourceName) {
        List<String> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new StringReader(text))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.add(line);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Unexpected I/O error reading in-memory text", e);
        }
        return parseLines(lines, sourceName);
    }

    /**
     * Splits UTF-8 bytes into lines ending in LF, CRLF or CR. A byte sequence that is not UTF-8
     * fails with the number of the line holding it.
     */
    static List<String> decodeLines(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        List<String> lines = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < bytes.length) {
            byte b = bytes[i];
            if (b == '\n' || b == '\r') {
                lines.add(decodeLine(decoder, bytes, start, i, lines.size() + 1));
                i += b == '\r' && i + 1 < bytes.length && bytes[i + 1] == '\n' ? 2 : 1;
                start = i;
            } else {
                i++;
            }
        }
        if (start < bytes.length) {
            lines.add(decodeLine(decoder, bytes, start, bytes.length, lines.size() + 1));
        }
        if (!lines.isEmpty() && lines.get(0).startsWith(BYTE_ORDER_MARK)) {
            lines.set(0, lines.get(0).substring(1));
        }
        return lines;
    }

    private static String decodeLine(CharsetDecoder decoder, byte[] bytes, int from, int to, int lineNumber) {
        try {
            return decoder.decode(ByteBuffer.wrap(bytes, from, to - from)).toString();
        } catch (CharacterCodingException e) {
            throw new MalformedRecordException(BlockKind.classify(new String(bytes, from, to - from,
                    StandardCharsets.US_ASCII)), lineNumber, "Input is not valid UTF-8", e);
        }
    }

    private MeshModel parseLines(List<String> lines, String sourceName) {
        MeshModel model = new CdbParser(lines, sourceName, options).parse();
        new ModelIntegrityChecker().check(model);
        return model;
    }
}
