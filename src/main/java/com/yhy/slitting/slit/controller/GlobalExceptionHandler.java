package com.yhy.slitting.slit.controller;

import com.yhy.slitting.slit.exception.AssemblyPartialFailureException;
import com.yhy.slitting.slit.exception.InvalidInputException;
import com.yhy.slitting.slit.vo.InvalidRecord;
import com.yhy.slitting.slit.vo.Plan;
import com.yhy.slitting.slit.vo.R;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public R<List<InvalidRecord>> invalidInput(InvalidInputException e) {
        return R.badRequest(e.getRecords(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public R<Void> notValid(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return R.badRequest(null, msg);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public R<Void> unreadable(HttpMessageNotReadableException e) {
        return R.badRequest(null, "请求体格式错误: " + e.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(AssemblyPartialFailureException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public R<Plan> partialFailure(AssemblyPartialFailureException e) {
        return R.failed(e.getPlan(), e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public R<Void> unexpected(Exception e) {
        LOGGER.error("Unhandled error", e);
        return R.failed("服务异常: " + e.getMessage());
    }
}
