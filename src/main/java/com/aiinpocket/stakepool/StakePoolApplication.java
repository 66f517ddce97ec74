package com.aiinpocket.stakepool;

import com.aiinpocket.stakepool.config.StakingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(StakingProperties.class)
public class StakePoolApplication {

    public static void main(String[] args) {
        SpringApplication.run(StakePoolApplication.class, args);
    }

}
