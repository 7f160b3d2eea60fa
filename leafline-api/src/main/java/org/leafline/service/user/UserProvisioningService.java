package org.leafline.service.user;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.leafline.model.entity.LeaflineUserEntity;
import org.leafline.repository.UserRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserProvisioningService {

    private final UserRepository userRepository;

    public LeaflineUserEntity provisionRemoteUser(String username) {
        try {
            LeaflineUserEntity user = userRepository.saveAndFlush(LeaflineUserEntity.builder().username(username).build());
            log.info("Provisioned user '{}' from trusted header", username);
            return user;
        } catch (DataIntegrityViolationException e) {
            // another request provisioned the same user first
            return userRepository.findByUsername(username).orElseThrow(() -> e);
        }
    }
}
