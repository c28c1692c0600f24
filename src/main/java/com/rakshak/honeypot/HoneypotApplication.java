package com.rakshak.honeypot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 詐騙蜜罐系統主應用程式
 * 接收對話訊息、判斷是否為詐騙並收集情資
 */
@SpringBootApplication
public class HoneypotApplication {

    public static void main(String[] args) {
        SpringApplication.run(HoneypotApplication.class, args);
        System.out.println("=================================");
        System.out.println("  詐騙蜜罐系統已啟動！");
        System.out.println("  API: POST http://localhost:8080/api/honeypot");
        System.out.println("=================================");
    }
}
