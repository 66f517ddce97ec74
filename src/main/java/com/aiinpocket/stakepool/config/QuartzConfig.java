package com.aiinpocket.stakepool.config;

import com.aiinpocket.stakepool.job.AutoCompoundJob;
import org.quartz.*;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class QuartzConfig {

    // AutoCompoundJob 扮演外部 keeper：每小時掃描一次已開啟自動複利的用戶
    @Bean
    public JobDetail autoCompoundJobDetail() {
        return JobBuilder.newJob(AutoCompoundJob.class)
                .withIdentity("autoCompoundJob", "staking")
                .storeDurably()
                .build();
    }

    @Bean
    public Trigger autoCompoundTrigger(JobDetail autoCompoundJobDetail) {
        return TriggerBuilder.newTrigger()
                .forJob(autoCompoundJobDetail)
                .withIdentity("autoCompoundTrigger", "staking")
                .withSchedule(CronScheduleBuilder.cronSchedule("0 0 * * * ?"))
                .build();
    }
}
