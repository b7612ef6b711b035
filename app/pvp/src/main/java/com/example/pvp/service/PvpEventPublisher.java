/*
 * どこで: PVP サービス層
 * 何を: 試合イベントの publish 口を抽象化する
 * なぜ: NATS 有効/無効で実装を差し替え、ライフサイクル側を変えずに済ませるため
 */
package com.example.pvp.service;

import com.example.pvp.model.MatchRecord;
import com.example.pvp.model.MatchResult;

public interface PvpEventPublisher {

  void publishMatchCreated(MatchRecord match);

  void publishMatchFinished(MatchResult result);
}
