package com.campus.messaging.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.List;

/**
 * RestTemplate for the history and group metadata endpoints.
 */
@Configuration
public class RestTemplateConfig {

    /**
     * JSON converter first so payloads served as text/plain or text/html still
     * parse; connect and read timeouts keep history loading from hanging a session open.
     */
    @Bean
    public RestTemplate restTemplate(@Value("${messaging.http.connect-timeout-ms:5000}") int connectTimeoutMs,
                                     @Value("${messaging.http.read-timeout-ms:10000}") int readTimeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);

        RestTemplate restTemplate = new RestTemplate(requestFactory);

        MappingJackson2HttpMessageConverter jsonConverter = new MappingJackson2HttpMessageConverter();
        List<MediaType> supportedMediaTypes = Arrays.asList(
            MediaType.APPLICATION_JSON,
            MediaType.TEXT_PLAIN,
            MediaType.TEXT_HTML,
            new MediaType("application", "*+json"),
            new MediaType("text", "*")
        );
        jsonConverter.setSupportedMediaTypes(supportedMediaTypes);
        restTemplate.getMessageConverters().add(0, jsonConverter);

        return restTemplate;
    }
}
