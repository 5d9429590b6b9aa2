package com.ivamare.interactions.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.interactions.InteractionsAutoConfiguration;
import com.ivamare.interactions.InteractionsProperties;
import com.ivamare.interactions.dispatch.InteractionDispatcher;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Auto-configuration of the interaction webhook endpoint.
 *
 * <p>Active in servlet web applications once {@code interactions.public-key} is set.
 */
@AutoConfiguration(after = {InteractionsAutoConfiguration.class, JacksonAutoConfiguration.class})
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnProperty(prefix = "interactions", name = "public-key")
@ConditionalOnBean(InteractionDispatcher.class)
public class InteractionsWebAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SignatureVerifier signatureVerifier(InteractionsProperties properties) {
        return new Ed25519SignatureVerifier(properties.getPublicKey());
    }

    @Bean
    @ConditionalOnMissingBean
    public InteractionDecoder interactionDecoder(
            ObjectProvider<ObjectMapper> objectMapper,
            InteractionsProperties properties) {
        return new InteractionDecoder(objectMapper.getIfAvailable(ObjectMapper::new), properties.getApplicationId());
    }

    @Bean
    @ConditionalOnMissingBean
    public InteractionController interactionController(
            SignatureVerifier signatureVerifier,
            InteractionDecoder interactionDecoder,
            InteractionDispatcher interactionDispatcher) {
        return new InteractionController(signatureVerifier, interactionDecoder, interactionDispatcher);
    }

    @Bean
    public InteractionDeliveryInterceptor interactionDeliveryInterceptor() {
        return new InteractionDeliveryInterceptor();
    }

    @Bean
    public WebMvcConfigurer interactionDeliveryConfigurer(InteractionDeliveryInterceptor interceptor) {
        return new WebMvcConfigurer() {
            @Override
            public void addInterceptors(InterceptorRegistry registry) {
                registry.addInterceptor(interceptor);
            }
        };
    }
}
