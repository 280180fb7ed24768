package com.aiinpocket.parkfinder.controller;

import com.aiinpocket.parkfinder.config.SecurityConfig;
import com.aiinpocket.parkfinder.exception.NotFoundOrHiddenException;
import com.aiinpocket.parkfinder.exception.UnauthorizedException;
import com.aiinpocket.parkfinder.model.entity.Park;
import com.aiinpocket.parkfinder.model.entity.ParkComment;
import com.aiinpocket.parkfinder.model.entity.ParkPhoto;
import com.aiinpocket.parkfinder.model.entity.ParkTag;
import com.aiinpocket.parkfinder.security.Caller;
import com.aiinpocket.parkfinder.service.ParkCommentService;
import com.aiinpocket.parkfinder.service.ParkPhotoService;
import com.aiinpocket.parkfinder.service.ParkTagService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {ParkPhotoController.class, ParkCommentController.class, ParkTagController.class})
@Import(SecurityConfig.class)
public class ParkContentControllerTest {

    private static final Park PARK = Park.builder().id(4L).name("大安森林公園").createdBy("owner").build();
    private static final Instant CREATED = Instant.parse("2025-03-01T08:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ParkPhotoService photoService;
    @MockitoBean
    private ParkCommentService commentService;
    @MockitoBean
    private ParkTagService tagService;
    @MockitoBean
    private JwtDecoder jwtDecoder;

    private static ParkPhoto photo(Long id, boolean approved) {
        return ParkPhoto.builder()
                .id(id)
                .park(PARK)
                .url("https://storage/parks/" + id + ".jpg")
                .uploadedBy("alice")
                .approved(approved)
                .createdAt(CREATED)
                .build();
    }

    private static ParkComment comment(Long id, boolean reported) {
        return ParkComment.builder()
                .id(id)
                .park(PARK)
                .authorId("alice")
                .content("單槓旁邊有飲水機")
                .reported(reported)
                .createdAt(CREATED)
                .build();
    }

    // ── 照片 ──

    @Test
    public void testAddPhotoIsCreated() throws Exception {
        when(photoService.addPhoto(Caller.user("alice"), 4L, "https://storage/parks/21.jpg"))
                .thenReturn(ParkPhoto.builder().id(21L).park(PARK).url("https://storage/parks/21.jpg")
                        .uploadedBy("alice").createdAt(CREATED).build());

        mockMvc.perform(post("/api/parks/4/photos")
                        .with(jwt().jwt(j -> j.subject("alice")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"url\": \"https://storage/parks/21.jpg\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(21))
                .andExpect(jsonPath("$.parkId").value(4))
                .andExpect(jsonPath("$.uploadedBy").value("alice"))
                .andExpect(jsonPath("$.approved").value(false));
    }

    @Test
    public void testListPhotosMapsParkId() throws Exception {
        when(photoService.listPhotos(Caller.anonymous(), 4L)).thenReturn(List.of(photo(1L, true), photo(2L, true)));

        mockMvc.perform(get("/api/parks/4/photos"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].id").value(2))
                .andExpect(jsonPath("$[1].parkId").value(4));
    }

    @Test
    public void testApprovalRequiresValue() throws Exception {
        mockMvc.perform(put("/api/photos/1/approval")
                        .with(jwt().jwt(j -> j.subject("root"))
                                .authorities(new SimpleGrantedAuthority("ROLE_ADMIN")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());

        verify(photoService, never()).setApproval(any(), anyLong(), anyBoolean());
    }

    @Test
    public void testAdminApprovesPhoto() throws Exception {
        when(photoService.setApproval(Caller.admin("root"), 1L, true)).thenReturn(photo(1L, true));

        mockMvc.perform(put("/api/photos/1/approval")
                        .with(jwt().jwt(j -> j.subject("root"))
                                .authorities(new SimpleGrantedAuthority("ROLE_ADMIN")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.approved").value(true));
    }

    @Test
    public void testNonAdminPhotoDeleteIsForbidden() throws Exception {
        doThrow(new UnauthorizedException("只有管理員可以刪除照片"))
                .when(photoService).deletePhoto(Caller.user("alice"), 1L);

        mockMvc.perform(delete("/api/photos/1").with(jwt().jwt(j -> j.subject("alice"))))
                .andExpect(status().isForbidden());
    }

    @Test
    public void testHiddenPhotoIsNotFound() throws Exception {
        when(photoService.getPhoto(Caller.anonymous(), 3L)).thenThrow(new NotFoundOrHiddenException("照片", 3L));

        mockMvc.perform(get("/api/photos/3"))
                .andExpect(status().isNotFound());
    }

    // ── 留言 ──

    @Test
    public void testAddCommentIsCreated() throws Exception {
        when(commentService.addComment(Caller.user("alice"), 4L, "單槓旁邊有飲水機")).thenReturn(comment(31L, false));

        mockMvc.perform(post("/api/parks/4/comments")
                        .with(jwt().jwt(j -> j.subject("alice")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\": \"單槓旁邊有飲水機\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(31))
                .andExpect(jsonPath("$.parkId").value(4))
                .andExpect(jsonPath("$.authorId").value("alice"))
                .andExpect(jsonPath("$.reported").value(false));
    }

    @Test
    public void testBlankCommentIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/parks/4/comments")
                        .with(jwt().jwt(j -> j.subject("alice")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"content\": \"  \"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testReportedRequiresValue() throws Exception {
        mockMvc.perform(put("/api/comments/31/reported")
                        .with(jwt().jwt(j -> j.subject("root"))
                                .authorities(new SimpleGrantedAuthority("ROLE_ADMIN")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": null}"))
                .andExpect(status().isBadRequest());

        verify(commentService, never()).setReported(any(), anyLong(), anyBoolean());
    }

    @Test
    public void testAdminReportsComment() throws Exception {
        when(commentService.setReported(Caller.admin("root"), 31L, true)).thenReturn(comment(31L, true));

        mockMvc.perform(put("/api/comments/31/reported")
                        .with(jwt().jwt(j -> j.subject("root"))
                                .authorities(new SimpleGrantedAuthority("ROLE_ADMIN")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reported").value(true));
    }

    @Test
    public void testAdminDeletesComment() throws Exception {
        mockMvc.perform(delete("/api/comments/31")
                        .with(jwt().jwt(j -> j.subject("root"))
                                .authorities(new SimpleGrantedAuthority("ROLE_ADMIN"))))
                .andExpect(status().isNoContent());

        verify(commentService).deleteComment(Caller.admin("root"), 31L);
    }

    // ── 標籤 ──

    @Test
    public void testAddTagIsCreated() throws Exception {
        when(tagService.addTag(Caller.user("alice"), 4L, "Pull-Up Bar"))
                .thenReturn(ParkTag.builder().id(41L).park(PARK).tag("pull-up bar").addedBy("alice").build());

        mockMvc.perform(post("/api/parks/4/tags")
                        .with(jwt().jwt(j -> j.subject("alice")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tag\": \"Pull-Up Bar\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(41))
                .andExpect(jsonPath("$.parkId").value(4))
                .andExpect(jsonPath("$.tag").value("pull-up bar"));
    }

    @Test
    public void testDuplicateTagIsBadRequest() throws Exception {
        when(tagService.addTag(Caller.user("alice"), 4L, "bars"))
                .thenThrow(new IllegalArgumentException("標籤 bars 已存在"));

        mockMvc.perform(post("/api/parks/4/tags")
                        .with(jwt().jwt(j -> j.subject("alice")))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tag\": \"bars\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testAddTagWithoutTokenIsUnauthenticated() throws Exception {
        mockMvc.perform(post("/api/parks/4/tags")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tag\": \"bars\"}"))
                .andExpect(status().isUnauthorized());

        verify(tagService, never()).addTag(any(), anyLong(), any());
    }

    @Test
    public void testNonAdminTagDeleteIsForbidden() throws Exception {
        doThrow(new UnauthorizedException("只有管理員可以刪除標籤"))
                .when(tagService).deleteTag(Caller.user("alice"), 41L);

        mockMvc.perform(delete("/api/tags/41").with(jwt().jwt(j -> j.subject("alice"))))
                .andExpect(status().isForbidden());
    }

    @Test
    public void testAdminDeletesTag() throws Exception {
        mockMvc.perform(delete("/api/tags/41")
                        .with(jwt().jwt(j -> j.subject("root"))
                                .authorities(new SimpleGrantedAuthority("ROLE_ADMIN"))))
                .andExpect(status().isNoContent());

        verify(tagService).deleteTag(Caller.admin("root"), 41L);
    }
}
