package com.aiinpocket.parkfinder.controller;

import com.aiinpocket.parkfinder.model.dto.ParkDetail;
import com.aiinpocket.parkfinder.model.dto.ParkRequest;
import com.aiinpocket.parkfinder.model.entity.Park;
import com.aiinpocket.parkfinder.model.enums.ParkStatus;
import com.aiinpocket.parkfinder.security.Caller;
import com.aiinpocket.parkfinder.service.ParkService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 公園提交 REST API。
 * 列表與詳情對匿名開放，結果依呼叫者身分過濾。
 */
@RestController
@RequestMapping("/api/parks")
@RequiredArgsConstructor
public class ParkController {

    private final ParkService parkService;

    /**
     * 列出呼叫者看得到的公園，可用 {@code ?status=PENDING} 等篩選。
     */
    @GetMapping
    public List<ParkDetail> listParks(Caller caller,
                                      @RequestParam(required = false) ParkStatus status) {
        return parkService.listVisibleParks(caller, status).stream()
                .map(p -> toDetail(p, caller))
                .toList();
    }

    @GetMapping("/{id}")
    public ParkDetail getPark(Caller caller, @PathVariable Long id) {
        return toDetail(parkService.getPark(caller, id), caller);
    }

    /** 提交新公園 */
    @PostMapping
    public ResponseEntity<ParkDetail> createPark(Caller caller, @Valid @RequestBody ParkRequest request) {
        Park park = parkService.createPark(caller, request.name(), request.description(),
                request.latitude(), request.longitude(), request.address());
        return ResponseEntity.status(HttpStatus.CREATED).body(toDetail(park, caller));
    }

    /** 管理員刪除公園（連帶刪除投票、照片、留言、標籤） */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deletePark(Caller caller, @PathVariable Long id) {
        parkService.deletePark(caller, id);
        return ResponseEntity.noContent().build();
    }

    private static ParkDetail toDetail(Park p, Caller caller) {
        return new ParkDetail(
                p.getId(),
                p.getName(),
                p.getDescription(),
                p.getLatitude(),
                p.getLongitude(),
                p.getAddress(),
                p.getStatus(),
                p.getUpvotes(),
                p.getDownvotes(),
                p.isOwnedBy(caller.userId()),
                p.getCreatedAt(),
                p.getDecidedAt()
        );
    }
}
