package com.gocomet.seatshare.booking.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gocomet.seatshare.booking.dto.BookingResponse;
import com.gocomet.seatshare.booking.dto.CreateBookingRequest;
import com.gocomet.seatshare.booking.dto.UpdateBookingRequest;
import com.gocomet.seatshare.booking.model.BookingStatus;
import com.gocomet.seatshare.booking.model.PickupStatus;
import com.gocomet.seatshare.booking.service.BookingService;
import com.gocomet.seatshare.common.exception.DuplicateRequestException;
import com.gocomet.seatshare.common.exception.InsufficientSeatsException;
import com.gocomet.seatshare.common.exception.PaymentDeclinedException;
import com.gocomet.seatshare.identity.CallerIdentity;
import com.gocomet.seatshare.identity.TrustedIdentityResolver;
import com.gocomet.seatshare.identity.UserRole;
import com.gocomet.seatshare.pickup.dto.PickupPinResponse;
import com.gocomet.seatshare.pickup.service.PickupVerificationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = RiderBookingController.class)
@Import(TrustedIdentityResolver.class)
@ActiveProfiles("test")
class RiderBookingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private BookingService bookingService;

    @MockBean
    private PickupVerificationService pickupVerificationService;

    private UUID riderId;
    private UUID rideId;
    private UUID bookingId;

    @BeforeEach
    void setUp() {
        riderId = UUID.randomUUID();
        rideId = UUID.randomUUID();
        bookingId = UUID.randomUUID();
    }

    @Test
    void createBooking_ValidRequest_Returns201() throws Exception {
        // Given
        when(bookingService.createBooking(eq(riderId), any(CreateBookingRequest.class)))
                .thenReturn(BookingResponse.builder()
                        .id(bookingId)
                        .rideId(rideId)
                        .riderId(riderId)
                        .numberOfSeats(2)
                        .status(BookingStatus.PENDING)
                        .confirmationNumber("SS-20261018-ABC234")
                        .build());

        // When & Then
        mockMvc.perform(post("/v1/bookings")
                        .requestAttr("userId", riderId.toString())
                        .requestAttr("role", "RIDER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(bookingId.toString()))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.confirmationNumber").value("SS-20261018-ABC234"));
    }

    @Test
    void createBooking_NoIdentity_Returns401() throws Exception {
        mockMvc.perform(post("/v1/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));

        verifyNoInteractions(bookingService);
    }

    @Test
    void createBooking_CalledByDriver_Returns403() throws Exception {
        mockMvc.perform(post("/v1/bookings")
                        .requestAttr("userId", UUID.randomUUID())
                        .requestAttr("role", UserRole.DRIVER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
    }

    @Test
    void createBooking_MissingPickupAddress_Returns400WithFieldError() throws Exception {
        // Given
        CreateBookingRequest request = validRequest();
        request.setPickupAddress(" ");

        // When & Then
        mockMvc.perform(post("/v1/bookings")
                        .requestAttr("userId", riderId.toString())
                        .requestAttr("role", "RIDER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.pickupAddress").value("Pickup address is required"));

        verifyNoInteractions(bookingService);
    }

    @Test
    void createBooking_NotEnoughSeats_Returns409WithAvailability() throws Exception {
        // Given
        when(bookingService.createBooking(eq(riderId), any(CreateBookingRequest.class)))
                .thenThrow(new InsufficientSeatsException(rideId, 2, 1));

        // When & Then
        mockMvc.perform(post("/v1/bookings")
                        .requestAttr("userId", riderId.toString())
                        .requestAttr("role", "RIDER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_SEATS"))
                .andExpect(jsonPath("$.details.availableSeats").value(1))
                .andExpect(jsonPath("$.details.requestedSeats").value(2));
    }

    @Test
    void createBooking_Duplicate_Returns409() throws Exception {
        // Given
        when(bookingService.createBooking(eq(riderId), any(CreateBookingRequest.class)))
                .thenThrow(new DuplicateRequestException("You already have a pending or confirmed booking for this ride"));

        // When & Then
        mockMvc.perform(post("/v1/bookings")
                        .requestAttr("userId", riderId.toString())
                        .requestAttr("role", "RIDER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("DUPLICATE_REQUEST"));
    }

    @Test
    void createBooking_PaymentDeclined_Returns402() throws Exception {
        // Given
        when(bookingService.createBooking(eq(riderId), any(CreateBookingRequest.class)))
                .thenThrow(new PaymentDeclinedException("Insufficient funds"));

        // When & Then
        mockMvc.perform(post("/v1/bookings")
                        .requestAttr("userId", riderId.toString())
                        .requestAttr("role", "RIDER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(validRequest())))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.code").value("PAYMENT_DECLINED"));
    }

    @Test
    void getMyBookings_ReturnsList() throws Exception {
        // Given
        when(bookingService.getRiderBookings(riderId)).thenReturn(List.of(
                BookingResponse.builder().id(bookingId).status(BookingStatus.CONFIRMED).build()));

        // When & Then
        mockMvc.perform(get("/v1/bookings")
                        .requestAttr("userId", riderId.toString())
                        .requestAttr("role", "RIDER"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(bookingId.toString()))
                .andExpect(jsonPath("$[0].status").value("CONFIRMED"));
    }

    @Test
    void getBooking_PassesCallerIdentity() throws Exception {
        // Given
        when(bookingService.getBooking(bookingId, new CallerIdentity(riderId, UserRole.RIDER)))
                .thenReturn(BookingResponse.builder().id(bookingId).build());

        // When & Then
        mockMvc.perform(get("/v1/bookings/{id}", bookingId)
                        .requestAttr("userId", riderId.toString())
                        .requestAttr("role", "RIDER"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(bookingId.toString()));
    }

    @Test
    void updateBooking_ZeroSeats_Returns400() throws Exception {
        mockMvc.perform(patch("/v1/bookings/{id}", bookingId)
                        .requestAttr("userId", riderId.toString())
                        .requestAttr("role", "RIDER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(UpdateBookingRequest.builder().numberOfSeats(0).build())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.numberOfSeats").value("Number of seats must be at least 1"));
    }

    @Test
    void updateBooking_ValidChange_Returns200() throws Exception {
        // Given
        when(bookingService.updateBooking(eq(bookingId), eq(riderId), any(UpdateBookingRequest.class)))
                .thenReturn(BookingResponse.builder().id(bookingId).numberOfSeats(3).build());

        // When & Then
        mockMvc.perform(patch("/v1/bookings/{id}", bookingId)
                        .requestAttr("userId", riderId.toString())
                        .requestAttr("role", "RIDER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"numberOfSeats\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.numberOfSeats").value(3));
    }

    @Test
    void cancelBooking_Returns200() throws Exception {
        // Given
        when(bookingService.cancelBooking(bookingId, riderId))
                .thenReturn(BookingResponse.builder().id(bookingId).status(BookingStatus.CANCELLED).build());

        // When & Then
        mockMvc.perform(post("/v1/bookings/{id}/cancel", bookingId)
                        .requestAttr("userId", riderId.toString())
                        .requestAttr("role", "RIDER"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));
    }

    @Test
    void getPickupPin_ReturnsPinForRider() throws Exception {
        // Given
        when(pickupVerificationService.getPickupPin(bookingId, riderId)).thenReturn(PickupPinResponse.builder()
                .bookingId(bookingId)
                .pin("4827")
                .expiresAt(LocalDateTime.of(2026, 10, 19, 9, 0))
                .pickupStatus(PickupStatus.PENDING)
                .build());

        // When & Then
        mockMvc.perform(get("/v1/bookings/{id}/pickup-pin", bookingId)
                        .requestAttr("userId", riderId.toString())
                        .requestAttr("role", "RIDER"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pin").value("4827"))
                .andExpect(jsonPath("$.pickupStatus").value("PENDING"));
    }

    @Test
    void getBooking_MalformedId_Returns400() throws Exception {
        mockMvc.perform(get("/v1/bookings/{id}", "not-a-uuid")
                        .requestAttr("userId", riderId.toString())
                        .requestAttr("role", "RIDER"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    private CreateBookingRequest validRequest() {
        return CreateBookingRequest.builder()
                .rideId(rideId)
                .numberOfSeats(2)
                .pickupAddress("Forum Mall, Koramangala")
                .pickupLat(12.9346)
                .pickupLng(77.6113)
                .build();
    }
}
