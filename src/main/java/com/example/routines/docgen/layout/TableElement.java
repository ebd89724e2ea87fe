package com.example.routines.docgen.layout;

import lombok.Value;

import java.util.List;

@Value
public class TableElement implements LayoutElement {
    List<List<String>> rows;
    TableStyle style;

    public int getColumnCount() {
        return rows.stream().mapToInt(List::size).max().orElse(0);
    }
}
