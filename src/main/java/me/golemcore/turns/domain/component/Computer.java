package me.golemcore.turns.domain.component;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.turns.domain.model.protocol.ComputerAction;

import java.util.List;

/**
 * Driver of the environment a computer tool controls.
 */
public interface Computer {

    /**
     * Takes a screenshot.
     *
     * @return base64-encoded PNG
     */
    String screenshot();

    void click(int x, int y, String button);

    void doubleClick(int x, int y);

    void drag(List<ComputerAction.Coordinate> path);

    void keypress(List<String> keys);

    void move(int x, int y);

    void scroll(int x, int y, int scrollX, int scrollY);

    void type(String text);

    void waitForUpdate();
}
