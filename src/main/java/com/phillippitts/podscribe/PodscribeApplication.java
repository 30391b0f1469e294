package com.phillippitts.podscribe;

import com.phillippitts.podscribe.config.properties.DownloadProperties;
import com.phillippitts.podscribe.config.properties.FeedProperties;
import com.phillippitts.podscribe.config.properties.ImportProperties;
import com.phillippitts.podscribe.config.properties.NotificationProperties;
import com.phillippitts.podscribe.config.properties.OutputProperties;
import com.phillippitts.podscribe.config.properties.SchedulerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        FeedProperties.class,
        ImportProperties.class,
        OutputProperties.class,
        DownloadProperties.class,
        NotificationProperties.class,
        SchedulerProperties.class
})
@EnableScheduling
public class PodscribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(PodscribeApplication.class, args);
    }

}
