package com.givebridge.payment.config;

import feign.Request;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class FeignConfig {

    /**
     * Donation confirmation is a single attempt. A slow donation service counts as a failed
     * confirmation and leads to a refund, so the read timeout stays short.
     */
    @Bean
    public Request.Options feignRequestOptions() {
        return new Request.Options(
                3, TimeUnit.SECONDS,
                5, TimeUnit.SECONDS,
                true
        );
    }
}
