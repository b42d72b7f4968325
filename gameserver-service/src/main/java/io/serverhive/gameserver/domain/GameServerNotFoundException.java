package io.serverhive.gameserver.domain;

public class GameServerNotFoundException extends GameServerOperationException {

    public GameServerNotFoundException(String gameServerId) {
        super(gameServerId, "game server " + gameServerId + " not found");
    }
}
