package com.flagship.expense_splitter.ledger;

import com.flagship.expense_splitter.ledger.dto.CreateGroupRequest;
import com.flagship.expense_splitter.ledger.dto.ExpenseRequest;
import com.flagship.expense_splitter.ledger.dto.GroupListResponse;
import com.flagship.expense_splitter.ledger.dto.GroupResponse;
import com.flagship.expense_splitter.ledger.dto.LogEntryResponse;
import com.flagship.expense_splitter.ledger.dto.MembersRequest;
import com.flagship.expense_splitter.ledger.dto.PaymentRequest;
import com.flagship.expense_splitter.ledger.dto.SettlementPlanResponse;
import com.flagship.expense_splitter.ledger.dto.SettlementRequest;
import com.flagship.expense_splitter.ledger.dto.SettlementTransactionDto;
import com.flagship.expense_splitter.ledger.dto.TransactionChangeResponse;
import com.flagship.expense_splitter.settlement.SettlementTransaction;
import com.flagship.expense_splitter.split.TransactionChange;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * REST controller for groups, expenses, payments and settlements.
 *
 * All amounts are minor currency units. Settling is a two step flow: GET the plan, then POST
 * the confirmed plan back to apply it.
 */
@RestController
@RequestMapping("/api/groups")
@RequiredArgsConstructor
@Slf4j
public class GroupController {

    private final GroupLedgerService ledgerService;

    @PostMapping
    public ResponseEntity<GroupResponse> createGroup(@Valid @RequestBody CreateGroupRequest request) {
        log.info("Received group creation request: name={}, members={}", request.getName(), request.getMembers().size());

        CurrencyCode currency = null;
        if (request.getCurrency() != null) {
            try {
                currency = CurrencyCode.valueOf(request.getCurrency());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unsupported currency code: " + request.getCurrency());
            }
        }

        Group group = ledgerService.createGroup(request.getName(), request.getMembers(), currency);
        return ResponseEntity.status(HttpStatus.CREATED).body(GroupResponse.from(group));
    }

    @GetMapping
    public ResponseEntity<GroupListResponse> listGroups() {
        List<GroupResponse> groups = ledgerService.listGroups().stream()
            .map(GroupResponse::from)
            .toList();
        String current = ledgerService.currentGroup().orElse(null);
        return ResponseEntity.ok(new GroupListResponse(current, groups));
    }

    @GetMapping("/{name}")
    public ResponseEntity<GroupResponse> getGroup(@PathVariable("name") String name) {
        return ResponseEntity.ok(GroupResponse.from(ledgerService.getGroup(name)));
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<Void> deleteGroup(@PathVariable("name") String name) {
        ledgerService.deleteGroup(name);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{name}/members")
    public ResponseEntity<GroupResponse> addMembers(@PathVariable("name") String name,
                                                    @Valid @RequestBody MembersRequest request) {
        return ResponseEntity.ok(GroupResponse.from(ledgerService.addMembers(name, request.getMembers())));
    }

    @PostMapping("/{name}/members/remove")
    public ResponseEntity<GroupResponse> removeMembers(@PathVariable("name") String name,
                                                       @Valid @RequestBody MembersRequest request) {
        return ResponseEntity.ok(GroupResponse.from(ledgerService.removeMembers(name, request.getMembers())));
    }

    /**
     * Records an expense. Responds with the applied change and the new balances.
     */
    @PostMapping("/{name}/expenses")
    public ResponseEntity<TransactionChangeResponse> addExpense(@PathVariable("name") String name,
                                                                @Valid @RequestBody ExpenseRequest request) {
        log.info("Received expense: amount={}, from={}, to={}, balanceRest={}",
            request.getAmount(), request.getFrom(), request.toOrEmpty(), request.isBalanceRestEnabled());

        TransactionChange change = ledgerService.allocateExpense(name, request.getDescription(),
            request.getAmount(), request.getFrom(), request.toOrEmpty(), request.isBalanceRestEnabled());
        Group group = ledgerService.getGroup(name);
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionChangeResponse.from(group, change));
    }

    @PostMapping("/{name}/payments")
    public ResponseEntity<TransactionChangeResponse> addPayment(@PathVariable("name") String name,
                                                                @Valid @RequestBody PaymentRequest request) {
        LogEntry entry = ledgerService.recordPayment(name, request.getAmount(), request.getFrom(), request.getTo());
        Group group = ledgerService.getGroup(name);
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionChangeResponse.from(group, entry.getChange()));
    }

    @GetMapping("/{name}/log")
    public ResponseEntity<List<LogEntryResponse>> getLog(@PathVariable("name") String name) {
        Group group = ledgerService.getGroup(name);
        List<LogEntry> log = group.getLog();
        List<LogEntryResponse> entries = new ArrayList<>(log.size());
        for (int i = 0; i < log.size(); i++) {
            entries.add(LogEntryResponse.from(i, log.get(i), group.getCurrency()));
        }
        return ResponseEntity.ok(entries);
    }

    /**
     * Reverts a log entry, the latest one unless an index is given. Responds with the removed entry.
     */
    @PostMapping("/{name}/undo")
    public ResponseEntity<LogEntryResponse> undo(@PathVariable("name") String name,
                                                 @RequestParam(value = "index", required = false) Integer index) {
        LogEntry removed = ledgerService.undo(name, index);
        Group group = ledgerService.getGroup(name);
        int removedIndex = index != null ? index : group.getLog().size();
        return ResponseEntity.ok(LogEntryResponse.from(removedIndex, removed, group.getCurrency()));
    }

    @GetMapping("/{name}/settlement")
    public ResponseEntity<SettlementPlanResponse> planSettlement(@PathVariable("name") String name) {
        List<SettlementTransactionDto> plan = ledgerService.planSettlement(name).stream()
            .map(SettlementTransactionDto::from)
            .toList();
        return ResponseEntity.ok(new SettlementPlanResponse(name, plan));
    }

    @PostMapping("/{name}/settlement")
    public ResponseEntity<TransactionChangeResponse> applySettlement(@PathVariable("name") String name,
                                                                     @Valid @RequestBody SettlementRequest request) {
        List<SettlementTransaction> transactions = request.getTransactions().stream()
            .map(SettlementTransactionDto::toDomain)
            .toList();
        TransactionChange change = ledgerService.applySettlement(name, transactions);
        Group group = ledgerService.getGroup(name);
        return ResponseEntity.ok(TransactionChangeResponse.from(group, change));
    }
}
