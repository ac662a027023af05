package com.bbthechange.teaminvite.config;

import com.bbthechange.teaminvite.repository.memory.InMemoryInviteRecordRepository;
import com.bbthechange.teaminvite.repository.memory.InMemoryRedeemCodeRepository;
import com.bbthechange.teaminvite.repository.memory.InMemorySeatStore;
import com.bbthechange.teaminvite.repository.memory.InMemoryTeamMemberRepository;
import com.bbthechange.teaminvite.repository.memory.InMemoryTeamRepository;
import com.bbthechange.teaminvite.repository.memory.InMemoryWaitingTaskRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single-process seat store for local runs and tests.
 */
@Configuration
@ConditionalOnProperty(name = "team-invite.store", havingValue = "memory")
public class MemoryStoreConfig {

    @Bean
    public InMemorySeatStore inMemorySeatStore(TeamInviteProperties properties) {
        return new InMemorySeatStore(properties.getReservation().getLockTimeout());
    }

    @Bean
    public InMemoryTeamRepository teamRepository(InMemorySeatStore store) {
        return new InMemoryTeamRepository(store);
    }

    @Bean
    public InMemoryTeamMemberRepository teamMemberRepository(InMemorySeatStore store) {
        return new InMemoryTeamMemberRepository(store);
    }

    @Bean
    public InMemoryInviteRecordRepository inviteRecordRepository(InMemorySeatStore store) {
        return new InMemoryInviteRecordRepository(store);
    }

    @Bean
    public InMemoryWaitingTaskRepository waitingTaskRepository(InMemorySeatStore store) {
        return new InMemoryWaitingTaskRepository(store);
    }

    @Bean
    public InMemoryRedeemCodeRepository redeemCodeRepository(InMemorySeatStore store) {
        return new InMemoryRedeemCodeRepository(store);
    }
}
