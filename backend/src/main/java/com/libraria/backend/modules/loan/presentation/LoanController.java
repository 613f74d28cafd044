package com.libraria.backend.modules.loan.presentation;

import java.util.UUID;

import com.libraria.backend.global.security.JwtAuthenticationPrincipal;
import com.libraria.backend.modules.loan.application.LoanService;
import com.libraria.backend.modules.loan.domain.LoanStatus;
import com.libraria.backend.modules.loan.presentation.dto.FineResponse;
import com.libraria.backend.modules.loan.presentation.dto.LoanListResponse;
import com.libraria.backend.modules.loan.presentation.dto.LoanResponse;
import com.libraria.backend.modules.loan.presentation.dto.LoanStatisticsResponse;
import com.libraria.backend.modules.loan.presentation.dto.RenewLoanRequest;
import com.libraria.backend.modules.loan.presentation.dto.ReturnLoanRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/loans")
public class LoanController {

    private final LoanService loanService;

    public LoanController(LoanService loanService) {
        this.loanService = loanService;
    }

    @Operation(summary = "List loans", description = "Own loans for members, every loan for librarians.")
    @GetMapping
    public ResponseEntity<LoanListResponse> listLoans(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "status", required = false) LoanStatus status,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(loanService.listLoans(principal, status, page, size));
    }

    @GetMapping("/current")
    public ResponseEntity<LoanListResponse> currentLoans(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(loanService.currentLoans(principal, page, size));
    }

    @GetMapping("/history")
    public ResponseEntity<LoanListResponse> history(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(loanService.history(principal, page, size));
    }

    @Operation(summary = "Overdue loans", description = "Marks due loans as OVERDUE, then lists them.")
    @GetMapping("/overdue")
    public ResponseEntity<LoanListResponse> overdueLoans(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(loanService.overdueLoans(principal, page, size));
    }

    @GetMapping("/statistics")
    public ResponseEntity<LoanStatisticsResponse> statistics() {
        return ResponseEntity.ok(loanService.statistics());
    }

    @GetMapping("/{loanId}")
    public ResponseEntity<LoanResponse> getLoan(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable("loanId") UUID loanId
    ) {
        return ResponseEntity.ok(loanService.getLoan(loanId, principal));
    }

    @Operation(summary = "Renew a loan")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Due date extended"),
            @ApiResponse(responseCode = "422", description = "`NOT_RENEWABLE` when overdue, closed or out of renewals")
    })
    @PostMapping("/{loanId}/renew")
    public ResponseEntity<LoanResponse> renew(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable("loanId") UUID loanId,
            @Valid @RequestBody(required = false) RenewLoanRequest request
    ) {
        return ResponseEntity.ok(loanService.renew(loanId, request, principal));
    }

    @PostMapping("/{loanId}/return")
    public ResponseEntity<LoanResponse> returnLoan(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable("loanId") UUID loanId,
            @Valid @RequestBody(required = false) ReturnLoanRequest request
    ) {
        return ResponseEntity.ok(loanService.returnLoan(loanId, request, principal));
    }

    @PostMapping("/{loanId}/fine")
    public ResponseEntity<FineResponse> calculateFine(@PathVariable("loanId") UUID loanId) {
        return ResponseEntity.ok(loanService.calculateFine(loanId));
    }

    @PostMapping("/{loanId}/pay-fine")
    public ResponseEntity<FineResponse> payFine(@PathVariable("loanId") UUID loanId) {
        return ResponseEntity.ok(loanService.payFine(loanId));
    }
}
