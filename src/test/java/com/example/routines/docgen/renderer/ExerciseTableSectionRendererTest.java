package com.example.routines.docgen.renderer;

import com.example.routines.docgen.layout.LayoutElement;
import com.example.routines.docgen.layout.ParagraphElement;
import com.example.routines.docgen.layout.SpacerElement;
import com.example.routines.docgen.layout.TableElement;
import com.example.routines.docgen.layout.TextStyle;
import com.example.routines.docgen.model.SectionType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.example.routines.docgen.TestTemplates.day;
import static com.example.routines.docgen.TestTemplates.exercise;
import static com.example.routines.docgen.TestTemplates.list;
import static com.example.routines.docgen.TestTemplates.map;
import static com.example.routines.docgen.renderer.RendererTestSupport.context;
import static com.example.routines.docgen.renderer.RendererTestSupport.only;
import static com.example.routines.docgen.renderer.RendererTestSupport.section;
import static org.junit.jupiter.api.Assertions.*;

public class ExerciseTableSectionRendererTest {
    private final ExerciseTableSectionRenderer renderer = new ExerciseTableSectionRenderer();

    @Test
    public void testStandardTableOnePerDay() {
        Map<String, Object> data = map(
                "current_week", 2,
                "dias", list(
                        day(1, "Pecho", exercise("Press banca", "12,10,8"), exercise("Aperturas", list(15, 12))),
                        day(2, "")));

        List<LayoutElement> elements = renderer.render(section("exercise_table", map()), context(data));

        List<ParagraphElement> headings = only(elements, ParagraphElement.class);
        assertEquals(Arrays.asList("Día 1 - Pecho", "Día 2"),
                Arrays.asList(headings.get(0).getText(), headings.get(1).getText()));
        assertEquals(TextStyle.SECTION_HEADER, headings.get(0).getStyle());

        List<TableElement> tables = only(elements, TableElement.class);
        assertEquals(2, tables.size());
        assertEquals(ExerciseTableSectionRenderer.DEFAULT_COLUMNS, tables.get(0).getRows().get(0));
        assertEquals(Arrays.asList("Press banca", "3", "12,10,8", "60s"), tables.get(0).getRows().get(1));
        assertEquals(Arrays.asList("Aperturas", "3", "15, 12", "60s"), tables.get(0).getRows().get(2));
        assertEquals(1, tables.get(0).getStyle().getHeaderRows());

        assertEquals(Arrays.asList("Sin ejercicios", "", "", ""), tables.get(1).getRows().get(1));
        assertTrue(elements.get(elements.size() - 1) instanceof SpacerElement);
    }

    @Test
    public void testNoDaysRendersEmptyState() {
        List<LayoutElement> elements = renderer.render(section("exercise_table", map()), context(map()));

        assertEquals(2, elements.size());
        ParagraphElement paragraph = (ParagraphElement) elements.get(0);
        assertEquals("Sin ejercicios", paragraph.getText());
        assertEquals(TextStyle.SMALL, paragraph.getStyle());
    }

    @Test
    public void testDaysAreFoundUnderRoutine() {
        Map<String, Object> data = map("routine", map("dias", list(day(1, "Piernas", exercise("Sentadilla", "8")))));

        List<TableElement> tables = only(renderer.render(section("exercise_table", map()), context(data)),
                TableElement.class);

        assertEquals(1, tables.size());
        assertEquals("Sentadilla", tables.get(0).getRows().get(1).get(0));
    }

    @Test
    public void testCustomColumnsMapToExerciseFields() {
        Map<String, Object> data = map("dias", list(day(1, "A", exercise("Remo", "10"))));

        TableElement table = only(renderer.render(
                section("exercise_table", map("columns", list("Ejercicio", "Reps"))), context(data)),
                TableElement.class).get(0);

        assertEquals(Arrays.asList("Ejercicio", "Reps"), table.getRows().get(0));
        assertEquals(Arrays.asList("Remo", "10"), table.getRows().get(1));
    }

    @Test
    public void testExcelWeeklyLaysWeeksOutAsColumns() {
        Map<String, Object> data = map(
                "current_week", 2,
                "dias", list(day(1, "Full", exercise("Press", "12,10,8"), exercise("Curl", list(15)))));

        TableElement table = only(renderer.render(
                section("exercise_table", map("format", "excel_weekly", "weeks", 3)), context(data)),
                TableElement.class).get(0);

        assertEquals(Arrays.asList("Ejercicio", "Semana 1", "Semana 2", "Semana 3"), table.getRows().get(0));
        assertEquals(Arrays.asList("Press", "12", "10", "8"), table.getRows().get(1));
        assertEquals(Arrays.asList("Curl", "15", "15", "15"), table.getRows().get(2));
        assertEquals(2, table.getStyle().getHighlightColumn());
        assertTrue(table.getStyle().isRepeatHeader());
    }

    @Test
    public void testExcelWeeklyHeaderLabels() {
        Map<String, Object> data = map("dias", list(day(1, "Full", exercise("Press", "12"))));

        TableElement table = only(renderer.render(section("exercise_table",
                        map("format", "excel_weekly", "weeks", 2, "week_columns", list("S1"))), context(data)),
                TableElement.class).get(0);
        assertEquals(Arrays.asList("Ejercicio", "S1", "Semana 2"), table.getRows().get(0));

        table = only(renderer.render(section("exercise_table",
                        map("format", "excel_weekly", "label", "Week")), context(data)),
                TableElement.class).get(0);
        assertEquals(5, table.getRows().get(0).size());
        assertEquals("Week 4", table.getRows().get(0).get(4));
    }

    @Test
    public void testWeeksAreCappedAtOneYear() {
        Map<String, Object> data = map("dias", list(day(1, "Full", exercise("Press", "12"))));

        TableElement table = only(renderer.render(
                section("exercise_table", map("format", "excel_weekly", "weeks", "20000")), context(data)),
                TableElement.class).get(0);

        assertEquals(ExerciseTableSectionRenderer.MAX_WEEKS + 1, table.getColumnCount());
        assertEquals("Semana 52", table.getRows().get(0).get(ExerciseTableSectionRenderer.MAX_WEEKS));
    }

    @Test
    public void testRepetitionsText() {
        assertEquals("12,10,8", ExerciseTableSectionRenderer.repetitionsText("12,10,8"));
        assertEquals("15, 12", ExerciseTableSectionRenderer.repetitionsText(list(15, 12)));
        assertEquals("", ExerciseTableSectionRenderer.repetitionsText(null));
    }

    @Test
    public void testWeeklyValue() {
        assertEquals("10", ExerciseTableSectionRenderer.weeklyValue("12, 10, 8", 2));
        assertEquals("8", ExerciseTableSectionRenderer.weeklyValue("12,10,8", 6));
        assertEquals("12", ExerciseTableSectionRenderer.weeklyValue(list(12, 10), 0));
        assertEquals("", ExerciseTableSectionRenderer.weeklyValue(Collections.emptyList(), 1));
    }

    @Test
    public void testSupportsOnlyExerciseTables() {
        assertTrue(renderer.supports(SectionType.EXERCISE_TABLE));
        assertFalse(renderer.supports(SectionType.TABLE));
    }
}
