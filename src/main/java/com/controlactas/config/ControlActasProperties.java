package com.controlactas.config;

import com.controlactas.model.OperatingMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "control-actas")
public class ControlActasProperties {

    /**
     * Folder holding one sub-folder per project.
     */
    private String baseRoot = "./data";
    private String project = "Grupo 4";
    private OperatingMode mode = OperatingMode.NORMAL;
    private Critical critical = new Critical();

    @Getter
    @Setter
    public static class Critical {
        // keyword -> reference unit price; order matters for equal-length keywords
        private Map<String, BigDecimal> activities = new LinkedHashMap<>();
        private boolean wordBoundary = false;
    }
}
