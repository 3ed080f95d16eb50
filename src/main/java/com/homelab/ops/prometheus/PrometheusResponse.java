package com.homelab.ops.prometheus;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Envelope returned by {@code /api/v1/query} and {@code /api/v1/query_range}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PrometheusResponse {

    @JsonProperty("status")
    private String status;

    @JsonProperty("errorType")
    private String errorType;

    @JsonProperty("error")
    private String error;

    @JsonProperty("data")
    private Data data;

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getErrorType() {
        return errorType;
    }

    public void setErrorType(String errorType) {
        this.errorType = errorType;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public boolean isSuccess() {
        return "success".equals(status);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Data {

        @JsonProperty("resultType")
        private String resultType;

        @JsonProperty("result")
        private List<Series> result;

        public String getResultType() {
            return resultType;
        }

        public void setResultType(String resultType) {
            this.resultType = resultType;
        }

        public List<Series> getResult() {
            return result;
        }

        public void setResult(List<Series> result) {
            this.result = result;
        }
    }

    /**
     * One series. Instant queries fill {@code value}, range queries fill {@code values};
     * each point is {@code [<epoch seconds>, "<value>"]}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Series {

        @JsonProperty("metric")
        private Map<String, String> metric;

        @JsonProperty("value")
        private List<Object> value;

        @JsonProperty("values")
        private List<List<Object>> values;

        public Map<String, String> getMetric() {
            return metric;
        }

        public void setMetric(Map<String, String> metric) {
            this.metric = metric;
        }

        public List<Object> getValue() {
            return value;
        }

        public void setValue(List<Object> value) {
            this.value = value;
        }

        public List<List<Object>> getValues() {
            return values;
        }

        public void setValues(List<List<Object>> values) {
            this.values = values;
        }
    }
}
