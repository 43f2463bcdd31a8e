package com.mycontent.reco.parser;

import java.util.List;
import java.util.OptionalInt;

public class ParserDtos {
    public record ArtifactError(String code, String message, int line, String artifact) {
        public String describe() {
            return line > 0 ? code + " at line " + line + ": " + message : code + ": " + message;
        }
    }

    public record CsvTable(List<String> header, List<List<String>> rows, List<Integer> lines) {
        public OptionalInt column(String name) {
            for (int i = 0; i < header.size(); i++) {
                if (header.get(i).equals(name)) return OptionalInt.of(i);
            }
            return OptionalInt.empty();
        }

        public String cell(int row, int column) {
            List<String> values = rows.get(row);
            return column < values.size() ? values.get(column) : "";
        }

        public int size() {
            return rows.size();
        }
    }
}
