package org.caureq.caureqspeedboard;

import org.caureq.caureqspeedboard.config.AppProps;
import org.caureq.caureqspeedboard.config.TelegramProps;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({AppProps.class, TelegramProps.class})
public class CaureqSpeedBoardApplication {

    public static void main(String[] args) {
        SpringApplication.run(CaureqSpeedBoardApplication.class, args);
    }

}
