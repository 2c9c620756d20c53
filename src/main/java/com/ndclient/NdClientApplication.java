package com.ndclient;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Boots the controller client as a non-web Spring application. Automation code obtains the
 * {@link com.ndclient.service.api.ControllerClient} and
 * {@link com.ndclient.endpoint.ManageEndpoints} beans from the returned context.
 */
@SpringBootApplication
public class NdClientApplication {

	public static void main(String[] args) {
        SpringApplication app = new SpringApplication(NdClientApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
	}

}
