package org.freightplan.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for the Distance Matrix API (GET distancematrix/json).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class DistanceMatrixDto {

    @JsonProperty("status")
    private String status;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("rows")
    private List<RowDto> rows;

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public List<RowDto> getRows() {
        return rows;
    }

    public void setRows(List<RowDto> rows) {
        this.rows = rows;
    }

    public boolean isOk() {
        return "OK".equals(status);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class RowDto {
        @JsonProperty("elements")
        private List<ElementDto> elements;

        public List<ElementDto> getElements() {
            return elements;
        }

        public void setElements(List<ElementDto> elements) {
            this.elements = elements;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ElementDto {
        @JsonProperty("status")
        private String status;

        @JsonProperty("distance")
        private ValueDto distance;

        @JsonProperty("duration")
        private ValueDto duration;

        public String getStatus() {
            return status;
        }

        public void setStatus(String status) {
            this.status = status;
        }

        public ValueDto getDistance() {
            return distance;
        }

        public void setDistance(ValueDto distance) {
            this.distance = distance;
        }

        public ValueDto getDuration() {
            return duration;
        }

        public void setDuration(ValueDto duration) {
            this.duration = duration;
        }

        public boolean isOk() {
            return "OK".equals(status) && distance != null && duration != null;
        }
    }

    /**
     * Distance in metres or duration in seconds.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ValueDto {
        @JsonProperty("value")
        private double value;

        @JsonProperty("text")
        private String text;

        public double getValue() {
            return value;
        }

        public void setValue(double value) {
            this.value = value;
        }

        public String getText() {
            return text;
        }

        public void setText(String text) {
            this.text = text;
        }
    }
}
