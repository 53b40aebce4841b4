package com.shopledger.checkout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = {
        "com.shopledger.checkout",
        "com.shopledger.common.exception"  // GlobalExceptionHandler 스캔
})
@EnableScheduling  // 만료 예약 정리 스케줄러
public class CheckoutApplication {
    public static void main(String[] args) {
        SpringApplication.run(CheckoutApplication.class, args);
    }
}
