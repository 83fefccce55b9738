package com.work.validator.host.web.dto;

import javax.validation.constraints.Positive;

public class WeightChangeRequest {

    @Positive(message = "weight 必须大于0")
    private long weight;

    public long getWeight() {
        return weight;
    }

    public void setWeight(long weight) {
        this.weight = weight;
    }
}
