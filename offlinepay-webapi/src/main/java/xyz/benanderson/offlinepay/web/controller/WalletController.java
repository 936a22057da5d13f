package xyz.benanderson.offlinepay.web.controller;

import io.javalin.http.BadRequestResponse;
import io.javalin.http.Context;
import io.javalin.http.HttpCode;
import xyz.benanderson.offlinepay.OfflinePay;
import xyz.benanderson.offlinepay.exception.OfflinePayException;
import xyz.benanderson.offlinepay.voucher.Voucher;
import xyz.benanderson.offlinepay.voucher.VoucherCodec;

import java.math.BigDecimal;

public record WalletController(OfflinePay offlinePay, String walletPrivateKey, String walletAddress) {

    public record AddressPayload(String address, String payload) {
    }

    public record VoucherPayload(String from, String to, String amount, long timestamp, String payload) {
    }

    public void getAddress(Context ctx) throws OfflinePayException {
        String payload = offlinePay.displayReceivingAddress(walletAddress);
        ctx.status(HttpCode.OK).json(new AddressPayload(walletAddress, payload));
    }

    /**
     * Issues a voucher from this device's wallet. The recipient is either {@code to} or the scanned
     * {@code address_payload}.
     */
    public void createVoucher(Context ctx) throws OfflinePayException {
        BigDecimal amount = ctx.queryParamAsClass("amount", BigDecimal.class).get();
        BigDecimal onChainBalance = ctx.queryParamAsClass("on_chain_balance", BigDecimal.class).allowNullable().get();
        String to = ctx.queryParam("to");
        if (to == null) {
            String addressPayload = ctx.queryParam("address_payload");
            if (addressPayload == null) throw new BadRequestResponse("parameter 'to' or 'address_payload' must be set");
            to = VoucherCodec.decodeAddress(addressPayload);
        }
        Voucher voucher = offlinePay.sendOffline(walletPrivateKey, to, amount, onChainBalance);
        ctx.status(HttpCode.OK).json(new VoucherPayload(voucher.from(), voucher.to(), voucher.amount(),
                voucher.timestamp(), offlinePay.displayVoucher(voucher)));
    }

}
