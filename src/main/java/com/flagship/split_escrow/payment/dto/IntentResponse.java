package com.flagship.split_escrow.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.split_escrow.payment.PaymentIntentService;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class IntentResponse {

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("milestone_id")
    UUID milestoneId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    String status;

    @JsonProperty("provider")
    String provider;

    @JsonProperty("provider_intent_id")
    String providerIntentId;

    @JsonProperty("client_secret")
    String clientSecret;

    @JsonProperty("checkout_url")
    String checkoutUrl;

    public static IntentResponse from(PaymentIntentService.IntentCreated created) {
        return IntentResponse.builder()
                .transactionId(created.getTransaction().getId())
                .milestoneId(created.getTransaction().getMilestoneId())
                .amount(created.getTransaction().getAmount())
                .currency(created.getTransaction().getCurrency().name())
                .status(created.getTransaction().getStatus().name())
                .provider(created.getTransaction().getProvider())
                .providerIntentId(created.getIntent().getProviderIntentId())
                .clientSecret(created.getIntent().getClientSecret())
                .checkoutUrl(created.getIntent().getCheckoutUrl())
                .build();
    }
}
