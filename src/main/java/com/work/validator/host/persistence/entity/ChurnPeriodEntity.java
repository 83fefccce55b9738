package com.work.validator.host.persistence.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

/**
 * 单行表（id=1）。
 */
@TableName("churn_period")
public class ChurnPeriodEntity {

    @TableId(type = IdType.INPUT)
    private Integer id;

    private Long startTime;

    private Long initialWeight;

    private Long totalWeight;

    private Long churnAmount;

    public Integer getId() {
        return id;
    }

    public void setId(Integer id) {
        this.id = id;
    }

    public Long getStartTime() {
        return startTime;
    }

    public void setStartTime(Long startTime) {
        this.startTime = startTime;
    }

    public Long getInitialWeight() {
        return initialWeight;
    }

    public void setInitialWeight(Long initialWeight) {
        this.initialWeight = initialWeight;
    }

    public Long getTotalWeight() {
        return totalWeight;
    }

    public void setTotalWeight(Long totalWeight) {
        this.totalWeight = totalWeight;
    }

    public Long getChurnAmount() {
        return churnAmount;
    }

    public void setChurnAmount(Long churnAmount) {
        this.churnAmount = churnAmount;
    }
}
