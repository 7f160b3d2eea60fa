package org.leafline.config.security.service;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.leafline.config.AppProperties;
import org.leafline.exception.ApiError;
import org.leafline.mapper.UserMapper;
import org.leafline.model.dto.LeaflineUser;
import org.leafline.model.entity.LeaflineUserEntity;
import org.leafline.repository.UserRepository;
import org.leafline.service.user.UserProvisioningService;
import org.springframework.stereotype.Service;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Optional;

/**
 * Resolves the caller from the header set by the authenticating proxy in front of the API.
 * Token issuance and credential checks happen upstream; this service only trusts the header.
 */
@Slf4j
@RequiredArgsConstructor
@Service
public class AuthenticationService {

    private final AppProperties appProperties;
    private final UserRepository userRepository;
    private final UserProvisioningService userProvisioningService;
    private final UserMapper userMapper;

    public LeaflineUser getAuthenticatedUser() {
        String headerName = appProperties.getAuth().getUserHeader();
        String username = currentUsername()
                .orElseThrow(() -> ApiError.GENERIC_UNAUTHORIZED.createException(headerName + " header is missing"));
        return resolveUser(username)
                .orElseThrow(() -> ApiError.GENERIC_UNAUTHORIZED.createException("Unknown user: " + username));
    }

    /**
     * The caller for endpoints that also answer anonymous requests. Empty when the header is
     * absent or names a user that may not be provisioned.
     */
    public Optional<LeaflineUser> findAuthenticatedUser() {
        return currentUsername().flatMap(this::resolveUser);
    }

    private Optional<String> currentUsername() {
        String headerName = appProperties.getAuth().getUserHeader();
        return currentRequest()
                .map(request -> request.getHeader(headerName))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    private Optional<LeaflineUser> resolveUser(String username) {
        Optional<LeaflineUserEntity> user = userRepository.findByUsername(username);
        if (user.isEmpty() && appProperties.getAuth().isCreateNewUsers()) {
            user = Optional.of(userProvisioningService.provisionRemoteUser(username));
        }
        return user.map(userMapper::toDto);
    }

    private Optional<HttpServletRequest> currentRequest() {
        if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attributes) {
            return Optional.of(attributes.getRequest());
        }
        return Optional.empty();
    }
}
