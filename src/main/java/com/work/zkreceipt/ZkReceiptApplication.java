package com.work.zkreceipt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 启动入口，运行后即可通过 REST 接口提交证明请求并查询 receipt。
 */
@SpringBootApplication
public class ZkReceiptApplication {

    public static void main(String[] args) {
        SpringApplication.run(ZkReceiptApplication.class, args);
    }
}
