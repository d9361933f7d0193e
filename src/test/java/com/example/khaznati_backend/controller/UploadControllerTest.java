package com.example.khaznati_backend.controller;

import com.example.khaznati_backend.config.StorageProperties;
import com.example.khaznati_backend.exception.QuotaExceededException;
import com.example.khaznati_backend.exception.ThrottledException;
import com.example.khaznati_backend.model.Account;
import com.example.khaznati_backend.model.StoredFile;
import com.example.khaznati_backend.service.AccountService;
import com.example.khaznati_backend.service.UploadCoordinator;
import com.example.khaznati_backend.service.UploadHandle;
import com.example.khaznati_backend.util.UploadState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = UploadController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(OwnerResolver.class)
class UploadControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private UploadCoordinator uploads;

    @MockitoBean
    private AccountService accountService;

    @MockitoBean
    private StorageProperties storageProperties;

    private Account alice;

    @BeforeEach
    void setUp() {
        alice = new Account("alice", "Alice", 1000);
        alice.setId(UUID.randomUUID());
        when(accountService.ensureByExternalSubject("alice", null)).thenReturn(alice);
        when(accountService.getByExternalSubjectOrThrow("alice")).thenReturn(alice);
    }

    @Test
    void initRegistersUpload() throws Exception {
        UUID uploadId = UUID.randomUUID();
        when(storageProperties.getChunkSizeBytes()).thenReturn(20 * 1024 * 1024);
        when(uploads.initUpload(eq(alice.getId()), eq("movie.mp4"), eq(4096L), any(), eq("video/mp4"), any()))
                .thenReturn(new UploadHandle(uploadId));

        mockMvc.perform(post("/v1/uploads")
                        .param("owner", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"movie.mp4\",\"size\":4096,\"mimeType\":\"video/mp4\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.uploadId").value(uploadId.toString()))
                .andExpect(jsonPath("$.state").value("INITIATED"))
                .andExpect(jsonPath("$.chunkSizeBytes").value(20 * 1024 * 1024));
    }

    @Test
    void initOverQuotaIsRejected() throws Exception {
        when(uploads.initUpload(eq(alice.getId()), eq("big.bin"), eq(200L), any(), any(), any()))
                .thenThrow(new QuotaExceededException(alice.getId(), 200, 900, 1000));

        mockMvc.perform(post("/v1/uploads")
                        .param("owner", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"big.bin\",\"size\":200}"))
                .andExpect(status().isPayloadTooLarge())
                .andExpect(jsonPath("$.error").value("QUOTA_EXCEEDED"));
    }

    @Test
    void initWithoutNameIsBadRequest() throws Exception {
        mockMvc.perform(post("/v1/uploads")
                        .param("owner", "alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void contentIsAcceptedForTheOwner() throws Exception {
        UUID uploadId = UUID.randomUUID();
        UploadHandle handle = new UploadHandle(uploadId);
        when(uploads.ownerOf(handle)).thenReturn(alice.getId());
        when(uploads.status(handle)).thenReturn(new UploadCoordinator.UploadStatus(
                uploadId, UploadState.UPLOADING, 0, 1, 5L, null, null));

        mockMvc.perform(multipart(HttpMethod.PUT, "/v1/uploads/{id}/content", uploadId)
                        .file(new MockMultipartFile("file", "a.txt", "text/plain", "hello".getBytes()))
                        .param("owner", "alice"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.state").value("UPLOADING"))
                .andExpect(jsonPath("$.expectedChunks").value(1));

        verify(uploads).receive(eq(handle), any());
    }

    @Test
    void uploadOfAnotherOwnerIsNotFound() throws Exception {
        UUID uploadId = UUID.randomUUID();
        when(uploads.ownerOf(new UploadHandle(uploadId))).thenReturn(UUID.randomUUID());

        mockMvc.perform(get("/v1/uploads/{id}", uploadId).param("owner", "alice"))
                .andExpect(status().isNotFound());

        verify(uploads, never()).status(any());
    }

    @Test
    void throttledCompletionCarriesRetryAfter() throws Exception {
        UUID uploadId = UUID.randomUUID();
        UploadHandle handle = new UploadHandle(uploadId);
        when(uploads.ownerOf(handle)).thenReturn(alice.getId());
        when(uploads.completeUpload(handle)).thenThrow(new ThrottledException("telegram", Duration.ofSeconds(30)));

        mockMvc.perform(post("/v1/uploads/{id}/complete", uploadId).param("owner", "alice"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "30"))
                .andExpect(jsonPath("$.error").value("THROTTLED"));
    }

    @Test
    void completeReturnsStoredFile() throws Exception {
        UUID uploadId = UUID.randomUUID();
        UploadHandle handle = new UploadHandle(uploadId);
        StoredFile file = new StoredFile(alice, "movie.mp4", 45);
        file.setId(UUID.randomUUID());
        file.setChunkCount(3);
        when(uploads.ownerOf(handle)).thenReturn(alice.getId());
        when(uploads.completeUpload(handle)).thenReturn(file);

        mockMvc.perform(post("/v1/uploads/{id}/complete", uploadId).param("owner", "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(file.getId().toString()))
                .andExpect(jsonPath("$.chunkCount").value(3))
                .andExpect(jsonPath("$.trashed").value(false));
    }
}
