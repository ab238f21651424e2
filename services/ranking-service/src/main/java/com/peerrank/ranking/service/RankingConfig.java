package com.peerrank.ranking.service;

import com.peerrank.ranking.execution.RankingExecutionProperties;
import com.peerrank.ranking.forensic.ForensicProperties;
import com.peerrank.ranking.policy.RankingPolicyProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
    RankingPolicyProperties.class,
    ForensicProperties.class,
    RankingExecutionProperties.class
})
public class RankingConfig {}
