package com.example.taskboard.realtime.config;

import com.example.taskboard.realtime.collaborator.InMemoryMembershipDirectory;
import com.example.taskboard.realtime.collaborator.JwtIdentityVerifier;
import com.example.taskboard.shared.collaborator.IdentityVerifier;
import com.example.taskboard.shared.collaborator.MembershipOracle;
import com.example.taskboard.shared.config.AppProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Default collaborators. A host application replaces either one by declaring its own
 * bean of the interface type.
 */
@Configuration
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean(IdentityVerifier.class)
    public JwtIdentityVerifier jwtIdentityVerifier(AppProperties appProperties, Clock clock) {
        return new JwtIdentityVerifier(appProperties.getJwt().getSecret(), clock);
    }

    @Bean
    @ConditionalOnMissingBean(MembershipOracle.class)
    public InMemoryMembershipDirectory inMemoryMembershipDirectory(AppProperties appProperties) {
        return new InMemoryMembershipDirectory(appProperties.getMembership().getGrants());
    }
}
