package com.realdonation.registry.api;

import com.realdonation.registry.api.ProjectResponses.Balance;
import com.realdonation.registry.infrastructure.bank.NativeValueBank;
import com.realdonation.security.Address;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/accounts")
public class AccountController {

    private final NativeValueBank bank;

    public AccountController(NativeValueBank bank) {
        this.bank = bank;
    }

    @GetMapping("/{address}/balance")
    public Balance balance(@PathVariable String address) {
        Address account = Address.parse(address);
        return new Balance(account.toHex(), bank.balanceOf(account));
    }
}
