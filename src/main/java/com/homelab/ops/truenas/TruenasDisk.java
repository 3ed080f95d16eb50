package com.homelab.ops.truenas;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry of {@code GET /api/v2.0/disk}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TruenasDisk {

    @JsonProperty("identifier")
    private String identifier;

    @JsonProperty("name")
    private String name;

    @JsonProperty("serial")
    private String serial;

    @JsonProperty("model")
    private String model;

    @JsonProperty("size")
    private Long size;

    @JsonProperty("pool")
    private String pool;

    @JsonProperty("hddstandby")
    private String hddStandby;

    public String getIdentifier() {
        return identifier;
    }

    public void setIdentifier(String identifier) {
        this.identifier = identifier;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSerial() {
        return serial;
    }

    public void setSerial(String serial) {
        this.serial = serial;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public Long getSize() {
        return size;
    }

    public void setSize(Long size) {
        this.size = size;
    }

    public String getPool() {
        return pool;
    }

    public void setPool(String pool) {
        this.pool = pool;
    }

    public String getHddStandby() {
        return hddStandby;
    }

    public void setHddStandby(String hddStandby) {
        this.hddStandby = hddStandby;
    }
}
