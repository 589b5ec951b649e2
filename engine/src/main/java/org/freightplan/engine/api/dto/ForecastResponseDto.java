package org.freightplan.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for the 5-day/3-hour forecast endpoint (GET forecast).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ForecastResponseDto {

    @JsonProperty("cod")
    private String code;

    @JsonProperty("list")
    private List<EntryDto> list;

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public List<EntryDto> getList() {
        return list;
    }

    public void setList(List<EntryDto> list) {
        this.list = list;
    }

    /**
     * One 3-hour slot.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EntryDto {
        @JsonProperty("dt")
        private long timestamp;

        @JsonProperty("weather")
        private List<ConditionDto> weather;

        public long getTimestamp() {
            return timestamp;
        }

        public void setTimestamp(long timestamp) {
            this.timestamp = timestamp;
        }

        public List<ConditionDto> getWeather() {
            return weather;
        }

        public void setWeather(List<ConditionDto> weather) {
            this.weather = weather;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConditionDto {
        @JsonProperty("main")
        private String main;

        @JsonProperty("description")
        private String description;

        public String getMain() {
            return main;
        }

        public void setMain(String main) {
            this.main = main;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }
    }
}
