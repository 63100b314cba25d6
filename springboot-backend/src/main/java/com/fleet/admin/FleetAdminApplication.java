package com.fleet.admin;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
@MapperScan("com.fleet.admin.mapper")
public class FleetAdminApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetAdminApplication.class, args);
    }

}
