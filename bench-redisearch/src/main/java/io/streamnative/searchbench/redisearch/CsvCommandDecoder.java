/*
 * Copyright © 2022-2024 StreamNative Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.streamnative.searchbench.redisearch;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import io.streamnative.searchbench.record.CommandCategory;
import io.streamnative.searchbench.record.CommandRecord;
import io.streamnative.searchbench.record.MalformedRecordException;
import io.streamnative.searchbench.record.RecordSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.util.Arrays;
import java.util.Optional;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Decodes one command per line from {@code category,id,command,arg1,arg2,...} lines.
 *
 * <p>Lines that cannot be decoded are logged and skipped. Only failures to read the underlying
 * stream are reported to the caller.
 */
@Slf4j
public final class CsvCommandDecoder implements RecordSource {
    private static final int MIN_FIELDS = 3;
    private static final ObjectReader LINE_READER =
            new CsvMapper().enable(CsvParser.Feature.WRAP_AS_ARRAY).readerFor(String[].class);

    private final BufferedReader reader;
    private long lineNumber;
    private long skipped;

    public CsvCommandDecoder(@NonNull BufferedReader reader) {
        this.reader = reader;
    }

    @Override
    public Optional<CommandRecord> next() throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isEmpty()) {
                continue;
            }
            try {
                return Optional.of(decode(line));
            } catch (MalformedRecordException e) {
                skipped++;
                log.warn("Skipping line {}: {}", lineNumber, e.getMessage());
            }
        }
        return Optional.empty();
    }

    @Override
    public long skipped() {
        return skipped;
    }

    /**
     * Decodes a single line. The transmitted size of the command is the length of the line
     * without its category label.
     */
    static CommandRecord decode(String line) throws MalformedRecordException {
        String[] fields = parse(line);
        if (fields.length < MIN_FIELDS) {
            throw new MalformedRecordException(
                    String.format(
                            "input line does not have the minimum required %d fields: %s", MIN_FIELDS, line));
        }
        CommandCategory category =
                CommandCategory.fromLabel(fields[0])
                        .orElseThrow(
                                () -> new MalformedRecordException("unknown command category " + fields[0]));
        long txBytes = line.getBytes(UTF_8).length - fields[0].getBytes(UTF_8).length;
        return new CommandRecord(
                category,
                fields[1],
                fields[2],
                Arrays.asList(fields).subList(MIN_FIELDS, fields.length),
                txBytes);
    }

    private static String[] parse(String line) throws MalformedRecordException {
        checkQuotes(line);
        try (MappingIterator<String[]> rows = LINE_READER.readValues(line)) {
            if (!rows.hasNextValue()) {
                throw new MalformedRecordException("empty input line");
            }
            return rows.nextValue();
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException("invalid CSV: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedRecordException("invalid CSV: " + e.getMessage(), e);
        }
    }

    /**
     * Rejects quotes the CSV reader would otherwise keep as data: a quote inside an unquoted
     * field, or text between a closing quote and the next separator.
     */
    static void checkQuotes(String line) throws MalformedRecordException {
        boolean quoted = false;
        boolean fieldStart = true;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        i++;
                    } else {
                        quoted = false;
                        if (i + 1 < line.length() && line.charAt(i + 1) != ',') {
                            throw new MalformedRecordException(
                                    String.format("invalid CSV: extraneous \" in field at column %d", i + 1));
                        }
                    }
                }
                continue;
            }
            if (c == ',') {
                fieldStart = true;
                continue;
            }
            if (c == '"') {
                if (!fieldStart) {
                    throw new MalformedRecordException(
                            String.format("invalid CSV: bare \" in non-quoted field at column %d", i + 1));
                }
                quoted = true;
            }
            fieldStart = false;
        }
        if (quoted) {
            throw new MalformedRecordException("invalid CSV: unterminated quoted field");
        }
    }
}
