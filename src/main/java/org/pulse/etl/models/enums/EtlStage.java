package org.pulse.etl.models.enums;

public enum EtlStage {
    EXTRACT("extract"),
    TRANSFORM("transform"),
    LOAD("load");

    private final String routingKey;

    EtlStage(String routingKey) {
        this.routingKey = routingKey;
    }

    public String routingKey() {
        return routingKey;
    }
}
