package com.gocomet.seatshare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SeatShareApplication {

    public static void main(String[] args) {
        SpringApplication.run(SeatShareApplication.class, args);
    }
}
