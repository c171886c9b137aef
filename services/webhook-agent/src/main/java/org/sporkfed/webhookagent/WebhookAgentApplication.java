package org.sporkfed.webhookagent;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication(scanBasePackages = {
        "org.sporkfed.webhookagent",
        "org.sporkfed.syncengine",
        "org.sporkfed.vcsclient"
})
@EnableAsync
public class WebhookAgentApplication {

    public static void main(String[] args) {

        SpringApplication.run(WebhookAgentApplication.class, args);
    }
}
