package com.example.routines.docgen.preview;

import com.example.routines.docgen.util.Values;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Placeholder routine used when a preview is requested without data.
 */
@Component
public class SampleDataGenerator {
    static final int DEFAULT_DAYS = 3;

    public Map<String, Object> generate(Map<String, Object> template) {
        int days = dayCount(template);
        List<Map<String, Object>> dias = new ArrayList<>();
        for (int i = 1; i <= days; i++) {
            Map<String, Object> day = new LinkedHashMap<>();
            day.put("numero", i);
            day.put("nombre", "");
            List<Map<String, Object>> exercises = new ArrayList<>();
            exercises.add(exercise("Sentadilla", "8-10", "90s"));
            exercises.add(exercise("Press banca", "8-10", "90s"));
            exercises.add(exercise("Remo", "10-12", "60s"));
            day.put("ejercicios", exercises);
            dias.add(day);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("gym_name", "Gimnasio");
        data.put("nombre_rutina", "Rutina de Ejemplo");
        data.put("usuario_nombre", "Juan Pérez");
        data.put("routine", Collections.singletonMap("uuid", "demo-uuid"));
        data.put("dias", dias);
        return data;
    }

    /**
     * {@code dias_semana} at the top level or in metadata, else three days.
     */
    static int dayCount(Map<String, Object> template) {
        if (template == null) {
            return DEFAULT_DAYS;
        }
        int days = Values.toInt(template.get("dias_semana"), 0);
        if (days <= 0) {
            days = Values.toInt(Values.asMap(template.get("metadata")).get("dias_semana"), 0);
        }
        return days > 0 ? days : DEFAULT_DAYS;
    }

    private static Map<String, Object> exercise(String name, String reps, String rest) {
        Map<String, Object> exercise = new LinkedHashMap<>();
        exercise.put("nombre", name);
        exercise.put("series", 3);
        exercise.put("repeticiones", reps);
        exercise.put("descanso", rest);
        return exercise;
    }
}
