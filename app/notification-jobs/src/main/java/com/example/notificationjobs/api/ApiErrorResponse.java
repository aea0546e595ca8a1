/*
 * どこで: NotificationJobs API
 * 何を: 共通のエラーレスポンスを表す
 * なぜ: ハンドルした例外をすべて同じ形で返すため
 */
package com.example.notificationjobs.api;

public record ApiErrorResponse(String code, String message) {}
