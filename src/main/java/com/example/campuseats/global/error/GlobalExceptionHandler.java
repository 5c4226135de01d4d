package com.example.campuseats.global.error;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestNotUsableException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.example.campuseats.global.error.dto.DetailedExceptionResponse;
import com.example.campuseats.global.error.dto.ErrorSpot;
import com.example.campuseats.global.error.dto.ExceptionResponse;
import com.example.campuseats.global.error.exception.BusinessException;
import com.example.campuseats.global.error.exception.ExceptionMessage;
import com.example.campuseats.global.error.exception.GlobalExceptionMessage;

import lombok.extern.slf4j.Slf4j;

/**
 * HTTP errors raised before a chat reply starts streaming. Failures inside a streamed turn never
 * reach this class; they are written into the stream as apology text.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ExceptionResponse> handleException(Exception exception) {
		log.error("{} : {}", exception.getClass().getSimpleName(), exception.toString(), exception);
		return buildExceptionResponse(GlobalExceptionMessage.INTERNAL_SERVER_ERROR_MESSAGE);
	}

	// the client closed a streaming response; there is nobody left to answer
	@ExceptionHandler(AsyncRequestNotUsableException.class)
	public void handleAsyncRequestNotUsableException(AsyncRequestNotUsableException exception) {
		log.debug("Response no longer usable: {}", exception.getMessage());
	}

	@ExceptionHandler(NoResourceFoundException.class)
	public ResponseEntity<ExceptionResponse> handleNoResourceFoundException(NoResourceFoundException exception) {
		log.warn("{} : {}", exception.getClass().getSimpleName(), exception.getMessage());
		return buildExceptionResponse(GlobalExceptionMessage.NO_RESOURCE_MESSAGE);
	}

	@ExceptionHandler(HttpRequestMethodNotSupportedException.class)
	public ResponseEntity<ExceptionResponse> handleHttpRequestMethodNotSupportedException(
		HttpRequestMethodNotSupportedException exception) {
		log.warn("{} : {}", exception.getClass().getSimpleName(), exception.getMethod());
		return buildExceptionResponse(GlobalExceptionMessage.METHOD_NOT_ALLOWED_MESSAGE);
	}

	// empty message, oversized message or session id
	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ResponseEntity<ExceptionResponse> handleMethodArgumentNotValidException(
		MethodArgumentNotValidException exception) {
		List<ErrorSpot> errorSpots = exception.getBindingResult()
			.getFieldErrors()
			.stream()
			.map(fieldError -> new ErrorSpot(fieldError.getField(), fieldError.getDefaultMessage()))
			.toList();
		log.warn("[{}] : {}", exception.getClass().getSimpleName(), errorSpots);

		return ResponseEntity.status(GlobalExceptionMessage.ARGUMENT_NOT_VALID_MESSAGE.getHttpStatus())
			.body(DetailedExceptionResponse.fail(GlobalExceptionMessage.ARGUMENT_NOT_VALID_MESSAGE, errorSpots));
	}

	@ExceptionHandler(HttpMessageNotReadableException.class)
	public ResponseEntity<ExceptionResponse> handleHttpMessageNotReadableException(
		HttpMessageNotReadableException exception) {
		log.warn("{} : {}", exception.getClass().getSimpleName(), exception.getMessage());
		return buildExceptionResponse(GlobalExceptionMessage.DATA_NOT_READABLE_MESSAGE);
	}

	@ExceptionHandler(HttpMediaTypeNotSupportedException.class)
	public ResponseEntity<ExceptionResponse> handleHttpMediaTypeNotSupportedException(
		HttpMediaTypeNotSupportedException exception) {
		log.warn("[{}] : {}", exception.getClass().getSimpleName(), exception.getMessage());
		return buildExceptionResponse(GlobalExceptionMessage.UNSUPPORTED_MEDIA_TYPE_MESSAGE);
	}

	// busy or unknown sessions are the caller's problem; a missing prompt or dead tool is ours
	@ExceptionHandler(BusinessException.class)
	public ResponseEntity<ExceptionResponse> handleBusinessException(BusinessException exception) {
		ExceptionMessage exceptionMessage = exception.getExceptionMessage();
		if (exceptionMessage.getHttpStatus().is5xxServerError()) {
			log.error("{} {}", exception.extractExceptionLocation(), exception.getMessage(), exception.getCause());
		} else {
			log.warn("{} {}", exception.extractExceptionLocation(), exception.getMessage());
		}
		return buildExceptionResponse(exceptionMessage);
	}

	private ResponseEntity<ExceptionResponse> buildExceptionResponse(ExceptionMessage exceptionMessage) {
		return ResponseEntity.status(exceptionMessage.getHttpStatus())
			.body(ExceptionResponse.fail(exceptionMessage));
	}
}
