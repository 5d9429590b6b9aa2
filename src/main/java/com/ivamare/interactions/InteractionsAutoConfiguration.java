package com.ivamare.interactions;

import com.ivamare.interactions.dispatch.ContinuationSupervisor;
import com.ivamare.interactions.dispatch.InteractionDispatcher;
import com.ivamare.interactions.dispatch.impl.DefaultInteractionDispatcher;
import com.ivamare.interactions.followup.FollowupClient;
import com.ivamare.interactions.followup.impl.RestFollowupClient;
import com.ivamare.interactions.handler.HandlerRegistry;
import com.ivamare.interactions.handler.impl.DefaultHandlerRegistry;
import com.ivamare.interactions.module.InteractionModule;
import com.ivamare.interactions.module.ModuleLifecycle;
import com.ivamare.interactions.module.ModuleLoader;
import com.ivamare.interactions.response.ResponseResolver;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.web.client.RestClientAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.client.RestClient;

import java.util.stream.Collectors;

/**
 * Auto-configuration for interaction dispatch.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Handler Registry</li>
 *   <li>Response Resolver</li>
 *   <li>Continuation Supervisor</li>
 *   <li>Follow-up Client</li>
 *   <li>Interaction Dispatcher</li>
 *   <li>Module Loader, loading every {@link InteractionModule} bean</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * interactions.enabled=false
 * </pre>
 */
@AutoConfiguration(after = RestClientAutoConfiguration.class)
@ConditionalOnProperty(prefix = "interactions", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(InteractionsProperties.class)
public class InteractionsAutoConfiguration {

    // --- Handler Registry ---

    @Bean
    @ConditionalOnMissingBean
    public HandlerRegistry handlerRegistry() {
        return new DefaultHandlerRegistry();
    }

    // --- Response Resolver ---

    @Bean
    @ConditionalOnMissingBean
    public ResponseResolver responseResolver() {
        return new ResponseResolver();
    }

    // --- Continuation Supervisor ---

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ContinuationSupervisor continuationSupervisor(InteractionsProperties properties) {
        return new ContinuationSupervisor(properties.getContinuation().getShutdownTimeout());
    }

    // --- Follow-up Client ---

    @Bean
    @ConditionalOnMissingBean
    public FollowupClient followupClient(
            InteractionsProperties properties,
            ObjectProvider<RestClient.Builder> restClientBuilder) {
        return new RestFollowupClient(
            restClientBuilder.getIfAvailable(RestClient::builder),
            properties.getFollowup().getBaseUrl(),
            properties.getFollowup().getUserAgent()
        );
    }

    // --- Dispatcher ---

    @Bean
    @ConditionalOnMissingBean
    public InteractionDispatcher interactionDispatcher(
            HandlerRegistry handlerRegistry,
            ResponseResolver responseResolver,
            FollowupClient followupClient,
            ContinuationSupervisor continuationSupervisor,
            InteractionsProperties properties) {
        return new DefaultInteractionDispatcher(
            handlerRegistry,
            responseResolver,
            followupClient,
            continuationSupervisor,
            properties.toDeferPolicy()
        );
    }

    // --- Modules ---

    @Bean
    @ConditionalOnMissingBean
    public ModuleLoader moduleLoader(HandlerRegistry handlerRegistry) {
        return new ModuleLoader(handlerRegistry);
    }

    @Bean
    public ModuleLifecycle interactionModuleLifecycle(
            ModuleLoader moduleLoader,
            ObjectProvider<InteractionModule> modules) {
        return new ModuleLifecycle(moduleLoader, modules.orderedStream().collect(Collectors.toList()));
    }
}
