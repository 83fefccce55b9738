package com.work.validator.host.web.dto;

import com.work.validator.core.model.PChainOwner;

import javax.validation.constraints.Min;
import java.util.ArrayList;
import java.util.List;

public class PChainOwnerDto {

    @Min(value = 0, message = "threshold 不能为负")
    private int threshold;

    private List<String> addresses = new ArrayList<>();

    public PChainOwner toModel() {
        return new PChainOwner(threshold, addresses);
    }

    public int getThreshold() {
        return threshold;
    }

    public void setThreshold(int threshold) {
        this.threshold = threshold;
    }

    public List<String> getAddresses() {
        return addresses;
    }

    public void setAddresses(List<String> addresses) {
        this.addresses = addresses;
    }
}
