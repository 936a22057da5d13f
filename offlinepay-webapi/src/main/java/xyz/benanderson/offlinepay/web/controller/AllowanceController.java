package xyz.benanderson.offlinepay.web.controller;

import io.javalin.http.Context;
import io.javalin.http.HttpCode;
import xyz.benanderson.offlinepay.OfflinePay;
import xyz.benanderson.offlinepay.exception.OfflinePayException;
import xyz.benanderson.offlinepay.exception.ValidationException;
import xyz.benanderson.offlinepay.voucher.VoucherCodec;
import xyz.benanderson.offlinepay.web.OfflinePayAPI;

import java.math.BigDecimal;

public record AllowanceController(OfflinePay offlinePay) {

    public void getAllowance(Context ctx) throws OfflinePayException {
        String address = parseAddress(ctx);
        ctx.status(HttpCode.OK).json(OfflinePayAPI.ViewableAllowance.of(
                offlinePay.getAllowanceGuard().getAllowance(address)));
    }

    public void resetAllowance(Context ctx) throws OfflinePayException {
        String address = parseAddress(ctx);
        BigDecimal limit = ctx.queryParamAsClass("limit", BigDecimal.class).get();
        ctx.status(HttpCode.OK).json(OfflinePayAPI.ViewableAllowance.of(
                offlinePay.getAllowanceGuard().resetAllowance(address, limit)));
    }

    private static String parseAddress(Context ctx) throws ValidationException {
        String address = ctx.pathParam("address");
        if (!VoucherCodec.isValidAddress(address)) throw new ValidationException("Invalid address: " + address);
        return address;
    }

}
