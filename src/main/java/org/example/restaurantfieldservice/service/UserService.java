package org.example.restaurantfieldservice.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.restaurantfieldservice.dto.UserDTO;
import org.example.restaurantfieldservice.dto.UserUpdateRequest;
import org.example.restaurantfieldservice.entity.AppUser;
import org.example.restaurantfieldservice.enums.ChangeOperation;
import org.example.restaurantfieldservice.enums.UserRole;
import org.example.restaurantfieldservice.event.EntityChangeEvent;
import org.example.restaurantfieldservice.exception.PermissionDeniedException;
import org.example.restaurantfieldservice.exception.ResourceNotFoundException;
import org.example.restaurantfieldservice.mapper.ResourceMapper;
import org.example.restaurantfieldservice.repository.AppUserRepository;
import org.example.restaurantfieldservice.session.AccessGuard;
import org.example.restaurantfieldservice.session.SessionContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class UserService {

    static final String TABLE = "users";

    private final AppUserRepository userRepository;
    private final ResourceMapper mapper;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional(readOnly = true)
    public List<UserDTO> getUsers(UserRole role) {
        List<AppUser> users = role != null
                ? userRepository.findByRoleOrderByNameAsc(role)
                : userRepository.findAll(Sort.by("name").ascending());
        return users.stream().map(mapper::toDTO).toList();
    }

    @Transactional(readOnly = true)
    public UserDTO getUser(Long id) {
        return mapper.toDTO(findUser(id));
    }

    /**
     * Users edit their own profile; admins may edit anyone's.
     */
    public UserDTO updateUser(Long id, UserUpdateRequest request, SessionContext session) {
        if (!id.equals(session.getUserId()) && !session.isAdmin()) {
            throw new PermissionDeniedException("Permission denied: cannot edit another user's profile");
        }
        AppUser user = findUser(id);
        if (StringUtils.hasText(request.getName())) {
            user.setName(request.getName().trim());
        }
        if (request.getPhone() != null) {
            user.setPhone(request.getPhone().trim());
        }
        if (request.getSpecialization() != null) {
            user.setSpecialization(request.getSpecialization().trim());
        }
        if (request.getAvatarUrl() != null) {
            user.setAvatarUrl(request.getAvatarUrl().trim());
        }
        AppUser saved = userRepository.save(user);
        eventPublisher.publishEvent(new EntityChangeEvent(this, TABLE, saved.getId(), ChangeOperation.UPDATE));
        return mapper.toDTO(saved);
    }

    public UserDTO changeRole(Long id, UserRole role, SessionContext session) {
        AccessGuard.requireAdmin(session, "change role");
        AppUser user = findUser(id);
        UserRole previous = user.getRole();
        user.setRole(role);
        AppUser saved = userRepository.save(user);
        eventPublisher.publishEvent(new EntityChangeEvent(this, TABLE, saved.getId(), ChangeOperation.UPDATE));
        log.info("🔑 User {} role {} -> {} by admin {}", id, previous, role, session.getUserId());
        return mapper.toDTO(saved);
    }

    private AppUser findUser(Long id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("User", id));
    }
}
