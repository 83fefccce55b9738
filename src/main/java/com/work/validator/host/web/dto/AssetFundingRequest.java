package com.work.validator.host.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.math.BigInteger;

/**
 * 内存资产账本的充值 / ERC20 授权请求。
 */
public class AssetFundingRequest {

    @NotBlank(message = "account 不能为空")
    private String account;

    @NotNull(message = "amount 不能为空")
    private BigInteger amount;

    public String getAccount() {
        return account;
    }

    public void setAccount(String account) {
        this.account = account;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public void setAmount(BigInteger amount) {
        this.amount = amount;
    }
}
