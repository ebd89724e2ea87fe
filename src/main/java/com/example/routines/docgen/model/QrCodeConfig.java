package com.example.routines.docgen.model;

import com.example.routines.docgen.util.Values;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Template-level QR directive.
 */
@Value
@Builder
public class QrCodeConfig {
    public static final QrCodeConfig DISABLED = QrCodeConfig.builder()
            .enabled(false).position(QrPosition.NONE).build();

    boolean enabled;
    QrPosition position;
    String dataSource;
    String customData;
    /** Either a single length or a {@code {width, height}} map. */
    Object size;

    public static QrCodeConfig from(Object raw) {
        if (!(raw instanceof Map)) {
            return DISABLED;
        }
        Map<String, Object> map = Values.asMap(raw);
        Object source = map.get("data_source");
        Object custom = map.get("custom_data");
        return QrCodeConfig.builder()
                .enabled(Values.isTruthy(map.get("enabled")))
                .position(QrPosition.fromValue(map.get("position")))
                .dataSource(source == null ? null : Values.asString(source))
                .customData(custom == null ? null : Values.asString(custom))
                .size(map.get("size"))
                .build();
    }

    public boolean isActive() {
        return enabled && position != QrPosition.NONE;
    }
}
