package com.aiinpocket.parkfinder.controller;

import com.aiinpocket.parkfinder.model.dto.FlagRequest;
import com.aiinpocket.parkfinder.model.dto.PhotoDetail;
import com.aiinpocket.parkfinder.model.dto.PhotoRequest;
import com.aiinpocket.parkfinder.model.entity.ParkPhoto;
import com.aiinpocket.parkfinder.security.Caller;
import com.aiinpocket.parkfinder.service.ParkPhotoService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 公園照片 REST API。
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ParkPhotoController {

    private final ParkPhotoService photoService;

    @GetMapping("/parks/{parkId}/photos")
    public List<PhotoDetail> listPhotos(Caller caller, @PathVariable Long parkId) {
        return photoService.listPhotos(caller, parkId).stream()
                .map(ParkPhotoController::toDetail)
                .toList();
    }

    @PostMapping("/parks/{parkId}/photos")
    public ResponseEntity<PhotoDetail> addPhoto(Caller caller, @PathVariable Long parkId,
                                                @Valid @RequestBody PhotoRequest request) {
        ParkPhoto photo = photoService.addPhoto(caller, parkId, request.url());
        return ResponseEntity.status(HttpStatus.CREATED).body(toDetail(photo));
    }

    @GetMapping("/photos/{id}")
    public PhotoDetail getPhoto(Caller caller, @PathVariable Long id) {
        return toDetail(photoService.getPhoto(caller, id));
    }

    /** 管理員核准 / 撤銷核准 */
    @PutMapping("/photos/{id}/approval")
    public PhotoDetail setApproval(Caller caller, @PathVariable Long id,
                                   @Valid @RequestBody FlagRequest request) {
        return toDetail(photoService.setApproval(caller, id, request.value()));
    }

    @DeleteMapping("/photos/{id}")
    public ResponseEntity<Void> deletePhoto(Caller caller, @PathVariable Long id) {
        photoService.deletePhoto(caller, id);
        return ResponseEntity.noContent().build();
    }

    private static PhotoDetail toDetail(ParkPhoto p) {
        return new PhotoDetail(p.getId(), p.getPark().getId(), p.getUrl(),
                p.getUploadedBy(), p.isApproved(), p.getCreatedAt());
    }
}
