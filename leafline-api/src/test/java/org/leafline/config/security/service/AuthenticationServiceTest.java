package org.leafline.config.security.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.leafline.config.AppProperties;
import org.leafline.exception.APIException;
import org.leafline.mapper.UserMapper;
import org.leafline.model.dto.LeaflineUser;
import org.leafline.model.entity.LeaflineUserEntity;
import org.leafline.repository.UserRepository;
import org.leafline.service.user.UserProvisioningService;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuthenticationServiceTest {

    @Mock
    private UserRepository userRepository;
    @Mock
    private UserProvisioningService userProvisioningService;

    private final AppProperties appProperties = new AppProperties();
    private final MockHttpServletRequest request = new MockHttpServletRequest();
    private AuthenticationService service;

    @BeforeEach
    void setUp() {
        service = new AuthenticationService(appProperties, userRepository, userProvisioningService,
                Mappers.getMapper(UserMapper.class));
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(request));
    }

    @AfterEach
    void tearDown() {
        RequestContextHolder.resetRequestAttributes();
    }

    @Test
    void getAuthenticatedUser_resolvesExistingUserFromHeader() {
        request.addHeader("X-User-Id", " alice ");
        when(userRepository.findByUsername("alice"))
                .thenReturn(Optional.of(LeaflineUserEntity.builder().id(3L).username("alice").build()));

        LeaflineUser user = service.getAuthenticatedUser();

        assertEquals(3L, user.getId());
        assertEquals("alice", user.getUsername());
        verifyNoInteractions(userProvisioningService);
    }

    @Test
    void getAuthenticatedUser_provisionsUnknownUser() {
        request.addHeader("X-User-Id", "bob");
        when(userRepository.findByUsername("bob")).thenReturn(Optional.empty());
        when(userProvisioningService.provisionRemoteUser("bob"))
                .thenReturn(LeaflineUserEntity.builder().id(9L).username("bob").build());

        assertEquals(9L, service.getAuthenticatedUser().getId());
    }

    @Test
    void getAuthenticatedUser_rejectsUnknownUserWhenProvisioningDisabled() {
        appProperties.getAuth().setCreateNewUsers(false);
        request.addHeader("X-User-Id", "carol");
        when(userRepository.findByUsername("carol")).thenReturn(Optional.empty());

        APIException e = assertThrows(APIException.class, () -> service.getAuthenticatedUser());

        assertEquals(HttpStatus.UNAUTHORIZED, e.getStatus());
        verify(userProvisioningService, never()).provisionRemoteUser(any());
    }

    @Test
    void getAuthenticatedUser_missingHeaderIsUnauthorized() {
        APIException e = assertThrows(APIException.class, () -> service.getAuthenticatedUser());

        assertEquals(HttpStatus.UNAUTHORIZED, e.getStatus());
        assertTrue(e.getMessage().contains("X-User-Id"));
    }

    @Test
    void getAuthenticatedUser_honoursConfiguredHeaderName() {
        appProperties.getAuth().setUserHeader("Remote-User");
        request.addHeader("Remote-User", "dave");
        when(userRepository.findByUsername("dave"))
                .thenReturn(Optional.of(LeaflineUserEntity.builder().id(4L).username("dave").build()));

        assertEquals("dave", service.getAuthenticatedUser().getUsername());
    }

    @Test
    void findAuthenticatedUser_isEmptyForAnonymousRequest() {
        assertTrue(service.findAuthenticatedUser().isEmpty());
        verifyNoInteractions(userRepository);
    }

    @Test
    void findAuthenticatedUser_resolvesHeaderUser() {
        request.addHeader("X-User-Id", "erin");
        when(userRepository.findByUsername("erin"))
                .thenReturn(Optional.of(LeaflineUserEntity.builder().id(5L).username("erin").build()));

        assertEquals(5L, service.findAuthenticatedUser().orElseThrow().getId());
    }
}
