package xyz.benanderson.offlinepay.web;

import io.javalin.http.Context;
import io.javalin.http.ExceptionHandler;
import io.javalin.http.HttpCode;
import org.jetbrains.annotations.NotNull;
import xyz.benanderson.offlinepay.OfflinePay;
import xyz.benanderson.offlinepay.exception.InsufficientAllowanceException;
import xyz.benanderson.offlinepay.exception.InsufficientBalanceException;
import xyz.benanderson.offlinepay.exception.InvalidVoucherException;
import xyz.benanderson.offlinepay.exception.OfflinePayException;
import xyz.benanderson.offlinepay.exception.StorageException;

public class OfflinePayExceptionHandler implements ExceptionHandler<OfflinePayException> {

    static HttpCode statusOf(OfflinePayException exception) {
        if (exception instanceof StorageException)
            return HttpCode.INTERNAL_SERVER_ERROR;
        if (exception instanceof InsufficientAllowanceException || exception instanceof InsufficientBalanceException)
            return HttpCode.CONFLICT;
        if (exception instanceof InvalidVoucherException)
            return HttpCode.UNPROCESSABLE_ENTITY;
        return HttpCode.BAD_REQUEST;
    }

    @Override
    public void handle(@NotNull OfflinePayException exception, @NotNull Context ctx) {
        HttpCode status = statusOf(exception);
        if (status == HttpCode.INTERNAL_SERVER_ERROR) {
            OfflinePay.LOGGER.error("Request to " + ctx.path() + " failed", exception);
        }
        ctx.status(status).json(new OfflinePayAPI.JsonResponse(false, exception.getMessage()));
    }

}
