package com.catalogsync.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where outcome CSV files are written (catalogsync.output).
 */
@ConfigurationProperties(prefix = "catalogsync.output")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class OutputProperties {

    /** Directory for outcome files; created when missing. Existing files are appended to. */
    @NotBlank
    private String directory = "outputs";
}
