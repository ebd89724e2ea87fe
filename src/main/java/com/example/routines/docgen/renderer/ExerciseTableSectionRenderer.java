package com.example.routines.docgen.renderer;

import com.example.routines.docgen.core.RenderContext;
import com.example.routines.docgen.layout.LayoutElement;
import com.example.routines.docgen.layout.ParagraphElement;
import com.example.routines.docgen.layout.SpacerElement;
import com.example.routines.docgen.layout.TableElement;
import com.example.routines.docgen.layout.TableStyle;
import com.example.routines.docgen.layout.TextStyle;
import com.example.routines.docgen.model.Section;
import com.example.routines.docgen.model.SectionType;
import com.example.routines.docgen.util.UnitConverter;
import com.example.routines.docgen.util.Values;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the routine's training days, one heading and one table per day.
 *
 * Days come from {@code dias}, {@code rutina.dias} or {@code routine.dias}.
 * The {@code excel_weekly} format lays the repetitions of each week out in
 * their own column, like the spreadsheet routines do.
 */
@Component
public class ExerciseTableSectionRenderer implements SectionRenderer {
    static final List<String> DEFAULT_COLUMNS = Arrays.asList("Ejercicio", "Series", "Repeticiones", "Descanso");
    static final String EMPTY_STATE = "Sin ejercicios";
    static final String EXCEL_WEEKLY = "excel_weekly";
    static final int DEFAULT_WEEKS = 4;
    /** Upper bound of weekly columns, one year. */
    public static final int MAX_WEEKS = 52;
    static final String DEFAULT_WEEK_LABEL = "Semana";

    private static final double HEADING_GAP_MM = 3;
    private static final double DAY_GAP_MM = 4;
    private static final double EMPTY_GAP_MM = 6;
    private static final double SPACING_AFTER_MM = 8;

    @Override
    public List<LayoutElement> render(Section section, RenderContext context) {
        Map<String, Object> data = context.getData();
        List<?> days = findDays(data);
        List<LayoutElement> elements = new ArrayList<>();

        if (days.isEmpty()) {
            elements.add(new ParagraphElement(EMPTY_STATE, TextStyle.SMALL));
            elements.add(new SpacerElement((float) UnitConverter.mm(EMPTY_GAP_MM)));
            return elements;
        }

        boolean weekly = EXCEL_WEEKLY.equalsIgnoreCase(Values.asString(section.get("format")).trim());
        int currentWeek = Values.toInt(data.get("current_week"), 1);

        for (int i = 0; i < days.size(); i++) {
            Map<String, Object> day = Values.asMap(days.get(i));
            if (i > 0) {
                elements.add(new SpacerElement((float) UnitConverter.mm(DAY_GAP_MM)));
            }
            elements.add(new ParagraphElement(dayHeading(day, i), TextStyle.SECTION_HEADER, context.getHeadingColor()));
            elements.add(new SpacerElement((float) UnitConverter.mm(HEADING_GAP_MM)));
            List<?> exercises = exercises(day);
            elements.add(weekly
                    ? weeklyTable(section, exercises, currentWeek)
                    : standardTable(section, exercises));
        }
        context.spacingAfter(section, SPACING_AFTER_MM).ifPresent(elements::add);
        return elements;
    }

    @Override
    public boolean supports(SectionType type) {
        return type == SectionType.EXERCISE_TABLE;
    }

    static List<?> findDays(Map<String, Object> data) {
        List<?> days = Values.asList(data.get("dias"));
        if (days.isEmpty()) {
            days = Values.asList(Values.asMap(data.get("rutina")).get("dias"));
        }
        if (days.isEmpty()) {
            days = Values.asList(Values.asMap(data.get("routine")).get("dias"));
        }
        return days;
    }

    static String dayHeading(Map<String, Object> day, int index) {
        Object number = first(day, "numero", "dayNumber", "dia_semana");
        String heading = "Día " + (Values.isBlank(number) ? String.valueOf(index + 1) : Values.asString(number));
        Object name = first(day, "nombre", "dayName");
        if (!Values.isBlank(name)) {
            heading += " - " + Values.asString(name).trim();
        }
        return heading;
    }

    /**
     * The value of week {@code week} (1-based) from a list or comma separated
     * string; weeks past the end repeat the last value.
     */
    static String weeklyValue(Object repetitions, int week) {
        List<String> values = new ArrayList<>();
        if (repetitions instanceof List) {
            for (Object value : (List<?>) repetitions) {
                values.add(Values.asString(value).trim());
            }
        } else {
            for (String value : Values.asString(repetitions).split(",")) {
                values.add(value.trim());
            }
        }
        if (values.isEmpty()) {
            return "";
        }
        int index = Math.min(Math.max(week, 1), values.size()) - 1;
        return values.get(index);
    }

    /**
     * Repetitions as written in the routine; lists are joined with ", ".
     */
    static String repetitionsText(Object repetitions) {
        if (repetitions instanceof List) {
            List<String> values = new ArrayList<>();
            for (Object value : (List<?>) repetitions) {
                values.add(Values.asString(value).trim());
            }
            return String.join(", ", values);
        }
        return Values.asString(repetitions);
    }

    private TableElement standardTable(Section section, List<?> exercises) {
        List<String> columns = columns(section);
        List<List<String>> rows = new ArrayList<>();
        rows.add(columns);
        for (Object raw : exercises) {
            Map<String, Object> exercise = Values.asMap(raw);
            List<String> row = new ArrayList<>();
            for (String column : columns) {
                row.add(cell(exercise, column));
            }
            rows.add(row);
        }
        if (exercises.isEmpty()) {
            rows.add(emptyRow(columns.size()));
        }
        return new TableElement(rows, TableStyle.withHeader());
    }

    private TableElement weeklyTable(Section section, List<?> exercises, int currentWeek) {
        int weeks = Math.min(MAX_WEEKS, Math.max(1, Values.toInt(section.get("weeks"), DEFAULT_WEEKS)));
        List<?> labels = Values.asList(section.get("week_columns"));
        Object rawLabel = section.get("label");
        String label = Values.isBlank(rawLabel) ? DEFAULT_WEEK_LABEL : Values.asString(rawLabel).trim();

        List<String> header = new ArrayList<>();
        header.add(DEFAULT_COLUMNS.get(0));
        for (int w = 1; w <= weeks; w++) {
            header.add(w <= labels.size() && !Values.isBlank(labels.get(w - 1))
                    ? Values.asString(labels.get(w - 1))
                    : label + " " + w);
        }

        List<List<String>> rows = new ArrayList<>();
        rows.add(header);
        for (Object raw : exercises) {
            Map<String, Object> exercise = Values.asMap(raw);
            List<String> row = new ArrayList<>();
            row.add(Values.asString(first(exercise, "nombre", "ejercicio_nombre", "exercise_name")));
            Object repetitions = first(exercise, "repeticiones", "reps");
            for (int w = 1; w <= weeks; w++) {
                row.add(weeklyValue(repetitions, w));
            }
            rows.add(row);
        }
        if (exercises.isEmpty()) {
            rows.add(emptyRow(header.size()));
        }
        int highlight = currentWeek >= 1 && currentWeek <= weeks ? currentWeek : -1;
        TableStyle style = TableStyle.builder()
                .headerRows(1)
                .repeatHeader(true)
                .highlightColumn(highlight)
                .build();
        return new TableElement(rows, style);
    }

    private static List<String> columns(Section section) {
        List<String> columns = new ArrayList<>();
        for (Object column : Values.asList(section.get("columns"))) {
            if (!Values.isBlank(column)) {
                columns.add(Values.asString(column));
            }
        }
        return columns.isEmpty() ? DEFAULT_COLUMNS : columns;
    }

    /**
     * Maps a column label onto the exercise fields it displays.
     */
    private static String cell(Map<String, Object> exercise, String column) {
        switch (column.trim().toLowerCase(Locale.ROOT)) {
            case "ejercicio":
            case "nombre":
            case "exercise":
            case "name":
                return Values.asString(first(exercise, "nombre", "ejercicio_nombre", "exercise_name"));
            case "series":
            case "sets":
                return Values.asString(exercise.get("series"));
            case "repeticiones":
            case "reps":
                return repetitionsText(first(exercise, "repeticiones", "reps"));
            case "descanso":
            case "rest":
                return Values.asString(first(exercise, "descanso", "rest"));
            case "notas":
            case "notes":
                return Values.asString(first(exercise, "notas", "notes"));
            default:
                return Values.asString(exercise.get(column));
        }
    }

    private static List<String> emptyRow(int size) {
        List<String> row = new ArrayList<>(Collections.nCopies(size, ""));
        row.set(0, EMPTY_STATE);
        return row;
    }

    private static List<?> exercises(Map<String, Object> day) {
        List<?> exercises = Values.asList(day.get("ejercicios"));
        return exercises.isEmpty() ? Values.asList(day.get("exercises")) : exercises;
    }

    private static Object first(Map<String, Object> map, String... keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
