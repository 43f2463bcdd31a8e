package com.mycontent.reco.parser;

import com.mycontent.reco.exception.ArtifactLoadException;
import com.mycontent.reco.parser.ParserDtos.ArtifactError;
import com.mycontent.reco.parser.ParserDtos.CsvTable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Component
public class CsvTableReader {

    public CsvTable read(Path path) {
        String artifact = path.getFileName().toString();
        try {
            return parse(Files.readString(path, StandardCharsets.UTF_8), artifact);
        } catch (IOException e) {
            throw new ArtifactLoadException(artifact, e.getMessage(), e);
        }
    }

    public CsvTable parse(String content, String artifact) {
        if (!content.isEmpty() && content.charAt(0) == '\uFEFF') content = content.substring(1);

        List<ArtifactError> errors = new ArrayList<>();
        List<List<String>> records = new ArrayList<>();
        List<Integer> recordLines = new ArrayList<>();

        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean fieldWasQuoted = false;
        int line = 1;
        int recordLine = 1;

        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < content.length() && content.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    if (c == '\n') line++;
                    field.append(c);
                }
            } else if (c == '"' && field.length() == 0 && !fieldWasQuoted) {
                quoted = true;
                fieldWasQuoted = true;
            } else if (c == ',') {
                fields.add(field.toString());
                field.setLength(0);
                fieldWasQuoted = false;
            } else if (c == '\n' || c == '\r') {
                if (c == '\r' && i + 1 < content.length() && content.charAt(i + 1) == '\n') i++;
                fields.add(field.toString());
                addRecord(fields, recordLine, records, recordLines);
                fields = new ArrayList<>();
                field.setLength(0);
                fieldWasQuoted = false;
                line++;
                recordLine = line;
            } else {
                field.append(c);
            }
        }
        if (quoted) {
            errors.add(new ArtifactError("UNTERMINATED_QUOTE", "Quoted field is not closed", recordLine, artifact));
        }
        fields.add(field.toString());
        addRecord(fields, recordLine, records, recordLines);

        if (records.isEmpty()) {
            errors.add(new ArtifactError("MISSING_HEADER", "File has no header row", 1, artifact));
            throw new ArtifactLoadException(artifact, errors);
        }

        List<String> header = records.get(0).stream().map(String::trim).toList();
        List<List<String>> rows = records.subList(1, records.size());
        List<Integer> lines = recordLines.subList(1, recordLines.size());
        for (int r = 0; r < rows.size(); r++) {
            if (rows.get(r).size() > header.size()) {
                errors.add(new ArtifactError("COLUMN_COUNT",
                        "Expected at most " + header.size() + " columns but found " + rows.get(r).size(), lines.get(r), artifact));
            }
        }
        if (!errors.isEmpty()) {
            throw new ArtifactLoadException(artifact, errors);
        }
        return new CsvTable(header, List.copyOf(rows), List.copyOf(lines));
    }

    private void addRecord(List<String> fields, int line, List<List<String>> records, List<Integer> lines) {
        boolean blank = fields.size() == 1 && fields.get(0).isBlank();
        if (!blank) {
            records.add(List.copyOf(fields));
            lines.add(line);
        }
    }
}
