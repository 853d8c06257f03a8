package com.example.chat_client;

@FunctionalInterface
public interface ConnectivityListener {

  void onStateChanged(ConnectivityState previous, ConnectivityState current);
}
