package me.chatrelay.bot.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the professional directory spreadsheet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DirectoryEntry {

    public static final String UNSPECIFIED = "No especificada";

    private String name;
    private String title;
    private String specialty;

    @JsonProperty("coverage_area")
    private String coverageArea;

    private String phone;
    private String email;
    private String availability;

    /**
     * Returns the availability column, or {@link #UNSPECIFIED} when the cell is
     * empty.
     */
    public String getAvailabilityOrDefault() {
        return availability != null && !availability.isBlank() ? availability : UNSPECIFIED;
    }
}
