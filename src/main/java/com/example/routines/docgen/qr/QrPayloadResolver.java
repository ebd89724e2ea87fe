package com.example.routines.docgen.qr;

import com.example.routines.docgen.expression.ExpressionResolver;
import com.example.routines.docgen.util.Values;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the string a QR code encodes.
 *
 * <ul>
 *   <li>{@code custom_url}: the configured custom data, expressions resolved</li>
 *   <li>{@code user_data}: {@code user.id}, then {@code user.dni}</li>
 *   <li>anything else ({@code routine_uuid}): {@code routine.uuid}, then
 *       {@code routine.uuid_rutina}, then a top-level {@code uuid_rutina}</li>
 * </ul>
 * A blank result means no QR code.
 */
@Component
@RequiredArgsConstructor
public class QrPayloadResolver {
    public static final String ROUTINE_UUID = "routine_uuid";
    public static final String USER_DATA = "user_data";
    public static final String CUSTOM_URL = "custom_url";

    private final ExpressionResolver expressionResolver;

    public Optional<String> resolve(String dataSource, String customData, Map<String, Object> data) {
        String source = dataSource == null || dataSource.trim().isEmpty()
                ? ROUTINE_UUID
                : dataSource.trim().toLowerCase(Locale.ROOT);
        String payload;
        switch (source) {
            case CUSTOM_URL:
                payload = expressionResolver.resolve(customData, data);
                break;
            case USER_DATA:
                payload = userPayload(data);
                break;
            default:
                payload = routinePayload(data);
                break;
        }
        return Values.isBlank(payload) ? Optional.empty() : Optional.of(payload.trim());
    }

    private static String userPayload(Map<String, Object> data) {
        Map<String, Object> user = Values.asMap(data.get("user"));
        if (user.isEmpty()) {
            user = Values.asMap(data.get("usuario"));
        }
        return firstPresent(user.get("id"), user.get("dni"));
    }

    private static String routinePayload(Map<String, Object> data) {
        Map<String, Object> routine = Values.asMap(data.get("routine"));
        return firstPresent(routine.get("uuid"), routine.get("uuid_rutina"), data.get("uuid_rutina"));
    }

    private static String firstPresent(Object... candidates) {
        for (Object candidate : candidates) {
            if (!Values.isBlank(candidate)) {
                return Values.asString(candidate);
            }
        }
        return "";
    }
}
