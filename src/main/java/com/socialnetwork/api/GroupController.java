package com.socialnetwork.api;

import com.socialnetwork.domain.exception.BadRequestException;
import com.socialnetwork.domain.model.GroupInvitationView;
import com.socialnetwork.domain.model.GroupMemberView;
import com.socialnetwork.domain.model.GroupRequest;
import com.socialnetwork.domain.model.GroupView;
import com.socialnetwork.domain.model.JoinGroupRequest;
import com.socialnetwork.domain.model.JoinRequestView;
import com.socialnetwork.domain.model.MemberIdsRequest;
import com.socialnetwork.domain.service.GroupService;
import com.socialnetwork.infrastructure.security.SessionAuthInterceptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for groups, membership, invitations and join requests.
 *
 * Endpoints:
 * - GET /api/groups - Groups visible to the user
 * - GET /api/groups/mine - Groups the user belongs to
 * - POST /api/groups - Create a group
 * - GET|PUT|DELETE /api/groups/{id}
 * - POST /api/groups/{id}/join, /leave
 * - GET|POST /api/groups/{id}/members - List members, invite several users (creator)
 * - DELETE /api/groups/{groupId}/members/{memberId} - Remove a member (creator)
 * - POST /api/groups/{id}/invite - Invite one user (any member)
 * - GET /api/invitations - Pending invitations of the user
 * - POST /api/invitations/{id}/accept|reject
 * - POST /api/groups/{id}/request - Ask to join
 * - GET /api/groups/{id}/requests - Pending join requests (creator)
 * - POST /api/requests/{id}/accept|reject
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class GroupController {

    private final GroupService groupService;

    @GetMapping("/groups")
    public ResponseEntity<List<GroupView>> list(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return ResponseEntity.ok(groupService.list(userId, limit, offset));
    }

    @GetMapping("/groups/mine")
    public ResponseEntity<List<GroupView>> mine(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(groupService.userGroups(userId));
    }

    @PostMapping("/groups")
    public ResponseEntity<GroupView> create(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @RequestBody GroupRequest request) {
        log.info("Create group: userId={}, name={}", userId, request.getName());
        return ResponseEntity.status(HttpStatus.CREATED).body(groupService.create(userId, request));
    }

    @GetMapping("/groups/{id}")
    public ResponseEntity<GroupView> get(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        return ResponseEntity.ok(groupService.get(id, userId));
    }

    @PutMapping("/groups/{id}")
    public ResponseEntity<GroupView> update(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id,
            @RequestBody GroupRequest request) {
        return ResponseEntity.ok(groupService.update(id, userId, request));
    }

    @DeleteMapping("/groups/{id}")
    public ResponseEntity<Map<String, String>> delete(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        groupService.delete(id, userId);
        return ResponseEntity.ok(Map.of("message", "Group deleted successfully"));
    }

    @PostMapping("/groups/{id}/join")
    public ResponseEntity<Map<String, String>> join(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        groupService.join(id, userId);
        return ResponseEntity.ok(Map.of("message", "Joined group successfully"));
    }

    @PostMapping("/groups/{id}/leave")
    public ResponseEntity<Map<String, String>> leave(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        groupService.leave(id, userId);
        return ResponseEntity.ok(Map.of("message", "Left group successfully"));
    }

    @GetMapping("/groups/{id}/members")
    public ResponseEntity<List<GroupMemberView>> members(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        return ResponseEntity.ok(groupService.members(id, userId));
    }

    /**
     * Invite several users at once. Only the creator may do this.
     *
     * Request body:
     * {
     *   "user_ids": [2, 3, 4]
     * }
     */
    @PostMapping("/groups/{id}/members")
    public ResponseEntity<Map<String, Object>> addMembers(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id,
            @RequestBody MemberIdsRequest request) {
        int invited = groupService.addMembers(id, userId, request.allUserIds());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Invitations sent");
        body.put("invited", invited);
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/groups/{groupId}/members/{memberId}")
    public ResponseEntity<Map<String, String>> removeMember(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long groupId,
            @PathVariable Long memberId) {
        groupService.removeMember(groupId, userId, memberId);
        return ResponseEntity.ok(Map.of("message", "Member removed"));
    }

    @PostMapping("/groups/{id}/invite")
    public ResponseEntity<Map<String, String>> invite(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id,
            @RequestBody MemberIdsRequest request) {
        if (request.getUserId() == null) {
            throw new BadRequestException("user_id is required");
        }
        groupService.invite(id, userId, request.getUserId());
        return ResponseEntity.ok(Map.of("message", "Invitation sent"));
    }

    @GetMapping("/invitations")
    public ResponseEntity<List<GroupInvitationView>> invitations(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId) {
        return ResponseEntity.ok(groupService.invitations(userId));
    }

    @PostMapping("/invitations/{id}/accept")
    public ResponseEntity<Map<String, String>> acceptInvitation(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        groupService.acceptInvitation(id, userId);
        return ResponseEntity.ok(Map.of("message", "Invitation accepted"));
    }

    @PostMapping("/invitations/{id}/reject")
    public ResponseEntity<Map<String, String>> rejectInvitation(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        groupService.rejectInvitation(id, userId);
        return ResponseEntity.ok(Map.of("message", "Invitation declined"));
    }

    @PostMapping("/groups/{id}/request")
    public ResponseEntity<Map<String, Object>> requestJoin(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id,
            @RequestBody(required = false) JoinGroupRequest request) {
        Long requestId = groupService.requestJoin(id, userId, request == null ? null : request.getMessage());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Join request sent");
        body.put("request_id", requestId);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/groups/{id}/requests")
    public ResponseEntity<List<JoinRequestView>> joinRequests(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        return ResponseEntity.ok(groupService.joinRequests(id, userId));
    }

    @PostMapping("/requests/{id}/accept")
    public ResponseEntity<Map<String, String>> acceptJoinRequest(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        groupService.acceptJoinRequest(id, userId);
        return ResponseEntity.ok(Map.of("message", "Join request accepted"));
    }

    @PostMapping("/requests/{id}/reject")
    public ResponseEntity<Map<String, String>> rejectJoinRequest(
            @RequestAttribute(SessionAuthInterceptor.USER_ID_ATTRIBUTE) Long userId,
            @PathVariable Long id) {
        groupService.rejectJoinRequest(id, userId);
        return ResponseEntity.ok(Map.of("message", "Join request rejected"));
    }
}
